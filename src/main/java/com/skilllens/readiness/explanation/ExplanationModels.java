package com.skilllens.readiness.explanation;

import java.util.List;

public class ExplanationModels {
    public record Explanation(String readinessLevel,
                              List<String> strengths,
                              List<String> weaknesses,
                              List<Recommendation> recommendations,
                              List<String> advice,
                              String summary) {}

    /**
     * @param unblocks skills that list this one as a direct prerequisite
     * @param priority role weight times (1 + unblocks)
     */
    public record Recommendation(int rank, String skill, double weight, int unblocks, double priority) {}
}
