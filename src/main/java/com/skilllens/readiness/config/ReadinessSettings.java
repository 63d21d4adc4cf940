package com.skilllens.readiness.config;

import com.skilllens.readiness.scoring.ScoringModels.Weights;

/**
 * Immutable engine configuration handed to every scoring call.
 */
public record ReadinessSettings(Weights weights,
                                double strengthThreshold,
                                double weaknessThreshold,
                                int recommendationCount,
                                int experienceCeilingYears,
                                int projectCeilingCount) {
    public static final ReadinessSettings DEFAULT = new ReadinessSettings(Weights.DEFAULT, 70, 50, 5, 2, 3);

    public ReadinessSettings {
        if (weights == null) weights = Weights.DEFAULT;
        if (weaknessThreshold > strengthThreshold) {
            throw new IllegalArgumentException("Weakness threshold " + weaknessThreshold + " exceeds strength threshold " + strengthThreshold);
        }
        if (recommendationCount < 0) throw new IllegalArgumentException("Recommendation count must be >= 0");
        if (experienceCeilingYears < 0) throw new IllegalArgumentException("Experience ceiling must be >= 0");
        if (projectCeilingCount < 0) throw new IllegalArgumentException("Project ceiling must be >= 0");
    }

    public ReadinessSettings withWeights(Weights override) {
        return new ReadinessSettings(override, strengthThreshold, weaknessThreshold, recommendationCount, experienceCeilingYears, projectCeilingCount);
    }
}
