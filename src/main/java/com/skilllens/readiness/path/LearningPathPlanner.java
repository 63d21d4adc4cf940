package com.skilllens.readiness.path;

import com.skilllens.readiness.error.CycleException;
import com.skilllens.readiness.graph.SkillGraph;
import com.skilllens.readiness.graph.SkillGraphModels;
import com.skilllens.readiness.graph.SkillGraphModels.Skill;
import com.skilllens.readiness.path.LearningPathModels.LearningPath;
import com.skilllens.readiness.path.LearningPathModels.LearningStep;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class LearningPathPlanner {
    private static final String UNCATEGORIZED = "Unknown";

    public LearningPath plan(String targetRole, Collection<String> targets, Set<String> knownSkills, SkillGraph graph) {
        Set<String> known = knownSkills == null ? Set.of() : knownSkills;
        Set<String> nodes = new TreeSet<>();
        if (targets != null) {
            targets.stream().filter(Objects::nonNull).filter(s -> !known.contains(s)).forEach(nodes::add);
        }

        Map<String, Set<String>> induced = new HashMap<>();
        for (String node : nodes) {
            induced.put(node, plannedPrerequisites(node, nodes, graph));
        }

        Comparator<String> easierFirst = Comparator.comparingInt((String s) -> difficulty(s, graph)).thenComparing(Comparator.naturalOrder());
        List<String> order = topologicalOrder(induced, easierFirst);

        List<LearningStep> steps = new ArrayList<>();
        Set<String> scheduled = new HashSet<>();
        int totalWeeks = 0;
        for (String skill : order) {
            List<String> unmet = new ArrayList<>();
            List<String> satisfied = new ArrayList<>();
            for (String prereq : directPrerequisites(skill, graph)) {
                if (known.contains(prereq)) {
                    satisfied.add(prereq);
                } else if (!scheduled.contains(prereq)) {
                    unmet.add(prereq);
                }
            }
            Optional<Skill> meta = graph.skill(skill);
            int weeks = meta.map(Skill::estimatedWeeks).orElse(SkillGraphModels.DEFAULT_DIFFICULTY);
            steps.add(new LearningStep(steps.size() + 1, skill,
                    meta.map(Skill::category).orElse(UNCATEGORIZED),
                    difficulty(skill, graph), weeks, List.copyOf(unmet), List.copyOf(satisfied)));
            scheduled.add(skill);
            totalWeeks += weeks;
        }
        return new LearningPath(targetRole, List.copyOf(steps), totalWeeks, formatWeeks(totalWeeks));
    }

    /**
     * Kahn's algorithm. {@code prerequisites} maps every node to its prerequisites
     * inside the node set; ready nodes are taken in {@code tieBreak} order.
     *
     * @throws CycleException if the nodes cannot all be drained
     */
    static List<String> topologicalOrder(Map<String, Set<String>> prerequisites, Comparator<String> tieBreak) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        prerequisites.forEach((node, prereqs) -> {
            inDegree.merge(node, 0, Integer::sum);
            for (String prereq : prereqs) {
                inDegree.merge(node, 1, Integer::sum);
                dependents.computeIfAbsent(prereq, k -> new ArrayList<>()).add(node);
            }
        });

        PriorityQueue<String> ready = new PriorityQueue<>(tieBreak);
        inDegree.forEach((node, degree) -> {
            if (degree == 0) ready.add(node);
        });

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String dependent : dependents.getOrDefault(node, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) ready.add(dependent);
            }
        }

        if (order.size() < inDegree.size()) {
            List<String> stuck = inDegree.entrySet().stream().filter(e -> e.getValue() > 0).map(Map.Entry::getKey).sorted().toList();
            throw new CycleException("Prerequisite cycle among skills " + stuck);
        }
        return order;
    }

    static String formatWeeks(int totalWeeks) {
        if (totalWeeks <= 0) return "0 weeks";
        int months = totalWeeks / 4;
        int weeks = totalWeeks % 4;
        if (months == 0) return totalWeeks + (totalWeeks == 1 ? " week" : " weeks");
        String out = months + (months == 1 ? " month" : " months");
        if (weeks > 0) out += " " + weeks + (weeks == 1 ? " week" : " weeks");
        return out;
    }

    /**
     * Nearest planned skills below {@code node}. The walk passes through skills
     * that are not planned (known, or left out of the plan), so an ordering
     * constraint is kept even when the skill in between is not a step.
     */
    private Set<String> plannedPrerequisites(String node, Set<String> nodes, SkillGraph graph) {
        Set<String> planned = new TreeSet<>();
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>(directPrerequisites(node, graph));
        while (!stack.isEmpty()) {
            String prereq = stack.pop();
            if (!seen.add(prereq)) continue;
            if (nodes.contains(prereq)) {
                planned.add(prereq);
            } else {
                stack.addAll(directPrerequisites(prereq, graph));
            }
        }
        return planned;
    }

    private Set<String> directPrerequisites(String skill, SkillGraph graph) {
        return graph.contains(skill) ? graph.prerequisitesOf(skill, false) : Set.of();
    }

    private int difficulty(String skill, SkillGraph graph) {
        return graph.skill(skill).map(Skill::difficulty).orElse(SkillGraphModels.DEFAULT_DIFFICULTY);
    }
}
