package com.skilllens.readiness.config;

import com.skilllens.readiness.scoring.ScoringModels.Weights;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "readiness")
public class ReadinessProperties {

    private WeightProperties weights = new WeightProperties();

    /** Factor scores at or above this value are reported as strengths. */
    private double strengthThreshold = 70;

    /** Factor scores below this value are reported as weaknesses. */
    private double weaknessThreshold = 50;

    private int recommendationCount = 5;

    /** Years of experience that earn full experience credit. */
    private int experienceCeilingYears = 2;

    /** Projects that earn full project credit. */
    private int projectCeilingCount = 3;

    public ReadinessSettings toSettings() {
        return new ReadinessSettings(
                new Weights(weights.getTechnical(), weights.getExperience(), weights.getProject(), weights.getTool()),
                strengthThreshold, weaknessThreshold, recommendationCount, experienceCeilingYears, projectCeilingCount);
    }

    public WeightProperties getWeights() {
        return weights;
    }

    public void setWeights(WeightProperties weights) {
        this.weights = weights;
    }

    public double getStrengthThreshold() {
        return strengthThreshold;
    }

    public void setStrengthThreshold(double strengthThreshold) {
        this.strengthThreshold = strengthThreshold;
    }

    public double getWeaknessThreshold() {
        return weaknessThreshold;
    }

    public void setWeaknessThreshold(double weaknessThreshold) {
        this.weaknessThreshold = weaknessThreshold;
    }

    public int getRecommendationCount() {
        return recommendationCount;
    }

    public void setRecommendationCount(int recommendationCount) {
        this.recommendationCount = recommendationCount;
    }

    public int getExperienceCeilingYears() {
        return experienceCeilingYears;
    }

    public void setExperienceCeilingYears(int experienceCeilingYears) {
        this.experienceCeilingYears = experienceCeilingYears;
    }

    public int getProjectCeilingCount() {
        return projectCeilingCount;
    }

    public void setProjectCeilingCount(int projectCeilingCount) {
        this.projectCeilingCount = projectCeilingCount;
    }

    public static class WeightProperties {
        private double technical = Weights.DEFAULT.technical();
        private double experience = Weights.DEFAULT.experience();
        private double project = Weights.DEFAULT.project();
        private double tool = Weights.DEFAULT.tool();

        public double getTechnical() {
            return technical;
        }

        public void setTechnical(double technical) {
            this.technical = technical;
        }

        public double getExperience() {
            return experience;
        }

        public void setExperience(double experience) {
            this.experience = experience;
        }

        public double getProject() {
            return project;
        }

        public void setProject(double project) {
            this.project = project;
        }

        public double getTool() {
            return tool;
        }

        public void setTool(double tool) {
            this.tool = tool;
        }
    }
}
