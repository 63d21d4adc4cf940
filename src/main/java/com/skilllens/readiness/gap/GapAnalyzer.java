package com.skilllens.readiness.gap;

import com.skilllens.readiness.domain.DomainModels.RoleRequirement;
import com.skilllens.readiness.domain.DomainModels.WeightedSkill;
import com.skilllens.readiness.gap.GapModels.GapReport;
import com.skilllens.readiness.gap.GapModels.MissingSkill;
import com.skilllens.readiness.graph.SkillGraph;
import com.skilllens.readiness.graph.SkillGraphModels.Importance;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Partitions a role's requirements against a candidate's skills and pulls in
 * every unmet transitive prerequisite of the missing ones.
 *
 * <p>A transitive prerequisite is REQUIRED only when some path of REQUIRED
 * edges leads to it from a missing role skill; any path crossing a RECOMMENDED
 * edge yields RECOMMENDED. Across paths the stricter tag wins.
 */
@Component
public class GapAnalyzer {

    public GapReport analyze(Set<String> candidateSkills, RoleRequirement role, SkillGraph graph) {
        Set<String> candidate = candidateSkills == null ? Set.of() : candidateSkills;

        List<String> matched = new ArrayList<>();
        List<WeightedSkill> directlyMissing = new ArrayList<>();
        for (WeightedSkill required : role.skills()) {
            if (candidate.contains(required.skill())) {
                matched.add(required.skill());
            } else {
                directlyMissing.add(required);
            }
        }

        Set<String> direct = new HashSet<>();
        directlyMissing.forEach(w -> direct.add(w.skill()));

        Map<String, Importance> tags = new HashMap<>();
        Map<String, Double> weights = new HashMap<>();
        Map<String, Set<String>> neededFor = new HashMap<>();

        for (WeightedSkill missing : directlyMissing) {
            if (!graph.contains(missing.skill())) continue;
            Map<String, Importance> reached = expand(missing.skill(), graph);
            reached.forEach((prereq, importance) -> {
                if (candidate.contains(prereq) || direct.contains(prereq)) return;
                tags.merge(prereq, importance, (a, b) -> a == Importance.REQUIRED || b == Importance.REQUIRED ? Importance.REQUIRED : Importance.RECOMMENDED);
                weights.merge(prereq, missing.weight(), Math::max);
                neededFor.computeIfAbsent(prereq, k -> new TreeSet<>()).add(missing.skill());
            });
        }

        List<MissingSkill> missingRequired = new ArrayList<>();
        List<MissingSkill> missingRecommended = new ArrayList<>();
        for (WeightedSkill missing : directlyMissing) {
            missingRequired.add(new MissingSkill(missing.skill(), Importance.REQUIRED, missing.weight(), true, List.of()));
        }
        new TreeSet<>(tags.keySet()).forEach(prereq -> {
            MissingSkill gap = new MissingSkill(prereq, tags.get(prereq), weights.get(prereq), false, List.copyOf(neededFor.get(prereq)));
            if (gap.importance() == Importance.REQUIRED) {
                missingRequired.add(gap);
            } else {
                missingRecommended.add(gap);
            }
        });

        Set<String> roleSkills = role.skillNames();
        List<String> extra = candidate.stream().filter(s -> !roleSkills.contains(s)).sorted().toList();

        return new GapReport(role.title(), List.copyOf(matched), List.copyOf(missingRequired), List.copyOf(missingRecommended), extra);
    }

    /** Every transitive prerequisite of {@code root}, tagged with the strictest importance over all paths. */
    private Map<String, Importance> expand(String root, SkillGraph graph) {
        Map<String, Importance> best = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            String node = stack.pop();
            Importance via = node.equals(root) ? Importance.REQUIRED : best.get(node);
            graph.directPrerequisites(node).forEach((prereq, edge) -> {
                Importance tag = via.weakest(edge);
                Importance seen = best.get(prereq);
                if (seen == null || (seen == Importance.RECOMMENDED && tag == Importance.REQUIRED)) {
                    best.put(prereq, tag);
                    stack.push(prereq);
                }
            });
        }
        return best;
    }
}
