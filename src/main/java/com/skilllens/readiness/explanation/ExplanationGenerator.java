package com.skilllens.readiness.explanation;

import com.skilllens.readiness.config.ReadinessSettings;
import com.skilllens.readiness.explanation.ExplanationModels.Explanation;
import com.skilllens.readiness.explanation.ExplanationModels.Recommendation;
import com.skilllens.readiness.gap.GapModels.GapReport;
import com.skilllens.readiness.gap.GapModels.MissingSkill;
import com.skilllens.readiness.graph.SkillGraph;
import com.skilllens.readiness.scoring.ScoringModels.FactorScore;
import com.skilllens.readiness.scoring.ScoringModels.ScoreBreakdown;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns a score breakdown and gap report into strengths, weaknesses and
 * ranked recommendations. Degrades to empty lists instead of throwing.
 */
@Component
public class ExplanationGenerator {
    private static final String KEEP_GOING = "Continue building on your strong foundation";

    public Explanation explain(String targetRole, ScoreBreakdown breakdown, GapReport gap, SkillGraph graph, ReadinessSettings settings) {
        ReadinessSettings cfg = settings == null ? ReadinessSettings.DEFAULT : settings;
        List<FactorScore> factors = breakdown == null || breakdown.factors() == null ? List.of() : breakdown.factors();
        double overall = breakdown == null ? 0.0 : breakdown.overallScore();

        List<String> strengths = factors.stream()
                .filter(f -> f.score() >= cfg.strengthThreshold())
                .sorted(Comparator.comparingDouble(FactorScore::score).reversed().thenComparing(f -> f.factor().ordinal()))
                .map(FactorScore::name)
                .toList();

        List<FactorScore> weak = factors.stream()
                .filter(f -> f.score() < cfg.weaknessThreshold())
                .sorted(Comparator.comparingDouble(FactorScore::score).thenComparing(f -> f.factor().ordinal()))
                .toList();
        List<String> weaknesses = weak.stream().map(FactorScore::name).toList();

        List<Recommendation> recommendations = recommend(gap, graph, cfg.recommendationCount());
        List<String> advice = advice(weak, recommendations);
        String level = readinessLevel(overall);

        return new Explanation(level, strengths, weaknesses, recommendations, advice,
                summary(targetRole, overall, level, strengths, weaknesses));
    }

    public List<Recommendation> recommend(GapReport gap, SkillGraph graph, int limit) {
        if (gap == null || gap.missingRequired() == null || limit <= 0) return List.of();

        record Candidate(String skill, double weight, int unblocks, double priority) {}
        List<Candidate> ranked = new ArrayList<>();
        for (MissingSkill missing : gap.missingRequired()) {
            int unblocks = graph != null && graph.contains(missing.skill()) ? graph.dependentsOf(missing.skill()).size() : 0;
            ranked.add(new Candidate(missing.skill(), missing.weight(), unblocks, missing.weight() * (1 + unblocks)));
        }
        ranked.sort(Comparator.comparingDouble(Candidate::priority).reversed().thenComparing(Candidate::skill));

        List<Recommendation> out = new ArrayList<>();
        for (int i = 0; i < Math.min(limit, ranked.size()); i++) {
            Candidate c = ranked.get(i);
            out.add(new Recommendation(i + 1, c.skill(), c.weight(), c.unblocks(), c.priority()));
        }
        return out;
    }

    public String readinessLevel(double score) {
        if (score >= 80) return "Excellent";
        if (score >= 60) return "Good";
        if (score >= 40) return "Moderate";
        return "Developing";
    }

    private List<String> advice(List<FactorScore> weak, List<Recommendation> recommendations) {
        List<String> lines = new ArrayList<>();
        for (FactorScore factor : weak) {
            switch (factor.factor()) {
                case TECHNICAL_SKILL -> {
                    if (!recommendations.isEmpty()) {
                        lines.add("Learn key skills: " + String.join(", ",
                                recommendations.stream().limit(3).map(Recommendation::skill).toList()));
                    }
                }
                case EXPERIENCE -> lines.add("Gain practical experience through internships or freelance projects");
                case PROJECT -> lines.add("Build 2-3 projects showcasing your skills");
                case TOOL -> lines.add("Practice with industry-standard tools and frameworks");
            }
        }
        if (lines.isEmpty()) lines.add(KEEP_GOING);
        return lines;
    }

    private String summary(String targetRole, double score, String level, List<String> strengths, List<String> weaknesses) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US, "Your readiness for %s is %s at %.1f%%.",
                targetRole == null ? "this role" : targetRole, level.toLowerCase(Locale.ROOT), score));
        if (!strengths.isEmpty()) sb.append(" Strong areas: ").append(String.join(", ", strengths)).append('.');
        if (!weaknesses.isEmpty()) sb.append(" Areas for improvement: ").append(String.join(", ", weaknesses)).append('.');
        return sb.toString();
    }
}
