package com.skilllens.readiness.scoring;

import com.skilllens.readiness.error.InvalidWeightException;

import java.util.List;

public class ScoringModels {
    public enum Factor {
        TECHNICAL_SKILL("Technical Skills"),
        EXPERIENCE("Experience"),
        PROJECT("Project Portfolio"),
        TOOL("Tool Proficiency");

        private final String displayName;

        Factor(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    /** Relative factor weights. Need not sum to 1; the engine divides by their sum. */
    public record Weights(double technical, double experience, double project, double tool) {
        public static final Weights DEFAULT = new Weights(0.40, 0.25, 0.20, 0.15);

        public Weights {
            check("technical", technical);
            check("experience", experience);
            check("project", project);
            check("tool", tool);
        }

        public double of(Factor factor) {
            return switch (factor) {
                case TECHNICAL_SKILL -> technical;
                case EXPERIENCE -> experience;
                case PROJECT -> project;
                case TOOL -> tool;
            };
        }

        public double sum() {
            return technical + experience + project + tool;
        }

        private static void check(String name, double value) {
            if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                throw new InvalidWeightException("Weight '" + name + "' must be a finite non-negative number, got " + value);
            }
        }
    }

    /**
     * @param weight       normalized weight, in [0,1]
     * @param contribution weight times score, the factor's share of the overall score
     */
    public record FactorScore(Factor factor, double score, double weight, double contribution, String details) {
        public String name() {
            return factor.displayName();
        }
    }

    public record ScoreBreakdown(double overallScore, List<FactorScore> factors) {
        public FactorScore factor(Factor factor) {
            return factors.stream().filter(f -> f.factor() == factor).findFirst().orElseThrow();
        }
    }
}
