package com.skilllens.readiness.graph;

import java.util.List;

public class SkillGraphModels {
    public static final int DEFAULT_DIFFICULTY = 3;

    public record Skill(String name, String category, int difficulty, int estimatedWeeks, int demand) {
        public Skill {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("Skill name must not be blank");
            if (difficulty < 1) throw new IllegalArgumentException("Difficulty tier must be >= 1: " + name);
            if (estimatedWeeks < 1) throw new IllegalArgumentException("Estimated weeks must be >= 1: " + name);
        }

        public Skill(String name, String category, int difficulty) {
            this(name, category, difficulty, difficulty, 50);
        }
    }

    public record PrerequisiteEdge(String skill, String prerequisite, Importance importance) {}

    public enum Importance {
        REQUIRED, RECOMMENDED;

        public Importance weakest(Importance other) {
            return this == REQUIRED && other == REQUIRED ? REQUIRED : RECOMMENDED;
        }
    }

    public record SkillDetails(Skill skill,
                               List<PrerequisiteEdge> directPrerequisites,
                               List<String> allPrerequisites,
                               List<String> dependents,
                               List<String> enables) {}
}
