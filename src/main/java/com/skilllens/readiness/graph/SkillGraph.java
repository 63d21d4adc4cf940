package com.skilllens.readiness.graph;

import com.skilllens.readiness.error.CycleException;
import com.skilllens.readiness.error.DuplicateSkillException;
import com.skilllens.readiness.error.UnknownSkillException;
import com.skilllens.readiness.graph.SkillGraphModels.Importance;
import com.skilllens.readiness.graph.SkillGraphModels.PrerequisiteEdge;
import com.skilllens.readiness.graph.SkillGraphModels.Skill;

import java.util.*;

/**
 * Directed acyclic graph of skills and their prerequisite edges.
 *
 * <p>State lives in an immutable {@link Snapshot} holding a forward index
 * (skill to its prerequisites) and a backward index (prerequisite to the
 * skills that need it). Readers work on whatever snapshot is current and never
 * lock. Writers are serialized on this instance and publish a fresh snapshot
 * only after the whole change has been validated, so a rejected write leaves
 * the graph untouched.
 */
public class SkillGraph {
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public void addSkill(Skill skill) {
        addSkill(skill, () -> {});
    }

    /**
     * Validates {@code skill}, runs {@code beforePublish} and only then publishes
     * the new snapshot. If {@code beforePublish} throws, the graph is unchanged.
     */
    public synchronized void addSkill(Skill skill, Runnable beforePublish) {
        Snapshot current = snapshot;
        if (current.skills().containsKey(skill.name())) {
            throw new DuplicateSkillException(skill.name());
        }
        Map<String, Skill> skills = new LinkedHashMap<>(current.skills());
        skills.put(skill.name(), skill);
        Snapshot next = new Snapshot(skills, current.forward(), current.backward());
        beforePublish.run();
        snapshot = next;
    }

    public void addPrerequisite(String skill, String prerequisite, Importance importance) {
        addPrerequisite(skill, prerequisite, importance, () -> {});
    }

    /**
     * Same contract as {@link #addSkill(Skill, Runnable)}. Re-adding an unchanged
     * edge is a no-op and does not run {@code beforePublish}.
     */
    public synchronized void addPrerequisite(String skill, String prerequisite, Importance importance, Runnable beforePublish) {
        Snapshot current = snapshot;
        requireKnown(current, skill);
        requireKnown(current, prerequisite);
        if (skill.equals(prerequisite) || reachable(current, prerequisite, skill)) {
            throw new CycleException("Edge " + skill + " -> " + prerequisite + " would create a cycle");
        }
        Importance existing = current.forward().getOrDefault(skill, Map.of()).get(prerequisite);
        if (existing == importance) return;

        Map<String, Map<String, Importance>> forward = copy(current.forward());
        Map<String, Map<String, Importance>> backward = copy(current.backward());
        forward.computeIfAbsent(skill, k -> new TreeMap<>()).put(prerequisite, importance);
        backward.computeIfAbsent(prerequisite, k -> new TreeMap<>()).put(skill, importance);
        Snapshot next = new Snapshot(current.skills(), forward, backward);
        beforePublish.run();
        snapshot = next;
    }

    public boolean contains(String name) {
        return name != null && snapshot.skills().containsKey(name);
    }

    public Optional<Skill> skill(String name) {
        return Optional.ofNullable(name == null ? null : snapshot.skills().get(name));
    }

    public List<Skill> skills() {
        return List.copyOf(snapshot.skills().values());
    }

    public int size() {
        return snapshot.skills().size();
    }

    public List<PrerequisiteEdge> edges() {
        List<PrerequisiteEdge> edges = new ArrayList<>();
        snapshot.forward().forEach((skill, prereqs) ->
                prereqs.forEach((prereq, importance) -> edges.add(new PrerequisiteEdge(skill, prereq, importance))));
        return edges;
    }

    /** Direct prerequisites with the importance of each edge, ordered by name. */
    public Map<String, Importance> directPrerequisites(String skill) {
        Snapshot current = snapshot;
        requireKnown(current, skill);
        return Collections.unmodifiableMap(current.forward().getOrDefault(skill, Map.of()));
    }

    public Set<String> prerequisitesOf(String skill, boolean transitive) {
        Snapshot current = snapshot;
        requireKnown(current, skill);
        if (!transitive) {
            return Collections.unmodifiableSet(new TreeSet<>(current.forward().getOrDefault(skill, Map.of()).keySet()));
        }
        Set<String> closure = new LinkedHashSet<>();
        collect(current.forward(), skill, closure);
        return Collections.unmodifiableSet(closure);
    }

    public Set<String> dependentsOf(String skill) {
        Snapshot current = snapshot;
        requireKnown(current, skill);
        return Collections.unmodifiableSet(new TreeSet<>(current.backward().getOrDefault(skill, Map.of()).keySet()));
    }

    /** Every skill that directly or transitively depends on {@code skill}. */
    public Set<String> enabledBy(String skill) {
        Snapshot current = snapshot;
        requireKnown(current, skill);
        Set<String> closure = new LinkedHashSet<>();
        collect(current.backward(), skill, closure);
        return Collections.unmodifiableSet(closure);
    }

    public Optional<Importance> importanceOf(String skill, String prerequisite) {
        return Optional.ofNullable(snapshot.forward().getOrDefault(skill, Map.of()).get(prerequisite));
    }

    private void collect(Map<String, Map<String, Importance>> index, String node, Set<String> out) {
        Deque<String> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            for (String next : index.getOrDefault(current, Map.of()).keySet()) {
                if (out.add(next)) stack.push(next);
            }
        }
    }

    private boolean reachable(Snapshot current, String from, String target) {
        Set<String> seen = new HashSet<>();
        collect(current.forward(), from, seen);
        return seen.contains(target);
    }

    private void requireKnown(Snapshot current, String skill) {
        if (skill == null || !current.skills().containsKey(skill)) {
            throw new UnknownSkillException(skill);
        }
    }

    private static Map<String, Map<String, Importance>> copy(Map<String, Map<String, Importance>> index) {
        Map<String, Map<String, Importance>> out = new TreeMap<>();
        index.forEach((k, v) -> out.put(k, new TreeMap<>(v)));
        return out;
    }

    private record Snapshot(Map<String, Skill> skills,
                            Map<String, Map<String, Importance>> forward,
                            Map<String, Map<String, Importance>> backward) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), Map.of());

        Snapshot {
            skills = Collections.unmodifiableMap(skills);
            Map<String, Map<String, Importance>> f = new TreeMap<>();
            forward.forEach((k, v) -> f.put(k, Collections.unmodifiableMap(v)));
            forward = Collections.unmodifiableMap(f);
            Map<String, Map<String, Importance>> b = new TreeMap<>();
            backward.forEach((k, v) -> b.put(k, Collections.unmodifiableMap(v)));
            backward = Collections.unmodifiableMap(b);
        }
    }
}
