package com.skilllens.readiness.domain;

import java.util.*;

public class DomainModels {
    public record RoleRequirement(String title, List<WeightedSkill> skills, Set<String> relevantTools) {
        public RoleRequirement {
            Objects.requireNonNull(title, "title");
            skills = skills == null ? List.of() : List.copyOf(skills);
            relevantTools = relevantTools == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(relevantTools));
            Set<String> seen = new HashSet<>();
            for (WeightedSkill s : skills) {
                if (!seen.add(s.skill())) {
                    throw new IllegalArgumentException("Role " + title + " lists skill twice: " + s.skill());
                }
            }
        }

        public Set<String> skillNames() {
            Set<String> names = new LinkedHashSet<>();
            skills.forEach(s -> names.add(s.skill()));
            return names;
        }

        public double weightOf(String skill) {
            return skills.stream().filter(s -> s.skill().equals(skill)).mapToDouble(WeightedSkill::weight).findFirst().orElse(0.0);
        }

        public double totalWeight() {
            return skills.stream().mapToDouble(WeightedSkill::weight).sum();
        }
    }

    public record WeightedSkill(String skill, double weight) {
        public WeightedSkill {
            Objects.requireNonNull(skill, "skill");
            if (!(weight > 0) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Role skill weight must be positive: " + skill + "=" + weight);
            }
        }
    }

    public record CandidateProfile(Set<String> skills, int yearsOfExperience, int projectCount, Set<String> tools) {
        public CandidateProfile {
            skills = names(skills, "skill");
            tools = names(tools, "tool");
            if (yearsOfExperience < 0) throw new IllegalArgumentException("Years of experience must be >= 0");
            if (projectCount < 0) throw new IllegalArgumentException("Project count must be >= 0");
        }

        public static CandidateProfile ofSkills(Set<String> skills) {
            return new CandidateProfile(skills, 0, 0, Set.of());
        }
    }

    /** Sorted, unmodifiable copy of a request's name list; null entries are rejected. */
    public static Set<String> names(Collection<String> names, String kind) {
        if (names == null) return Set.of();
        Set<String> out = new TreeSet<>();
        for (String name : names) {
            if (name == null) throw new IllegalArgumentException("A " + kind + " name must not be null");
            out.add(name);
        }
        return Collections.unmodifiableSet(out);
    }
}
