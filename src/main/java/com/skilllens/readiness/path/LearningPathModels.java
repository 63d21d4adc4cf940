package com.skilllens.readiness.path;

import java.util.List;

public class LearningPathModels {
    public record LearningStep(int position,
                               String skill,
                               String category,
                               int difficulty,
                               int estimatedWeeks,
                               List<String> unmetPrerequisites,
                               List<String> satisfiedPrerequisites) {}

    public record LearningPath(String targetRole, List<LearningStep> steps, int totalWeeks, String totalEstimatedTime) {
        public List<String> skills() {
            return steps.stream().map(LearningStep::skill).toList();
        }
    }
}
