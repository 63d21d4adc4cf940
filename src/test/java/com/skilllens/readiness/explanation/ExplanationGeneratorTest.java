package com.skilllens.readiness.explanation;

import com.skilllens.readiness.config.ReadinessSettings;
import com.skilllens.readiness.explanation.ExplanationModels.Explanation;
import com.skilllens.readiness.explanation.ExplanationModels.Recommendation;
import com.skilllens.readiness.gap.GapModels.GapReport;
import com.skilllens.readiness.gap.GapModels.MissingSkill;
import com.skilllens.readiness.graph.SkillGraph;
import com.skilllens.readiness.graph.SkillGraphModels.Importance;
import com.skilllens.readiness.graph.SkillGraphModels.Skill;
import com.skilllens.readiness.scoring.ScoringModels.Factor;
import com.skilllens.readiness.scoring.ScoringModels.FactorScore;
import com.skilllens.readiness.scoring.ScoringModels.ScoreBreakdown;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExplanationGeneratorTest {
    private final ExplanationGenerator generator = new ExplanationGenerator();

    private static FactorScore factor(Factor factor, double score) {
        return new FactorScore(factor, score, 0.25, 0.25 * score, "");
    }

    private static MissingSkill missing(String skill, double weight) {
        return new MissingSkill(skill, Importance.REQUIRED, weight, true, List.of());
    }

    private static GapReport gap(List<MissingSkill> missingRequired) {
        return new GapReport("Role", List.of(), missingRequired, List.of(), List.of());
    }

    @Test
    void classifiesFactorsAgainstThresholds() {
        ScoreBreakdown breakdown = new ScoreBreakdown(61.25, List.of(
                factor(Factor.TECHNICAL_SKILL, 75),
                factor(Factor.EXPERIENCE, 100),
                factor(Factor.PROJECT, 30),
                factor(Factor.TOOL, 40)));

        Explanation explanation = generator.explain("Data Engineer", breakdown, gap(List.of()), new SkillGraph(), ReadinessSettings.DEFAULT);

        assertEquals(List.of("Experience", "Technical Skills"), explanation.strengths());
        assertEquals(List.of("Project Portfolio", "Tool Proficiency"), explanation.weaknesses());
        assertEquals("Good", explanation.readinessLevel());
        assertEquals(List.of("Build 2-3 projects showcasing your skills", "Practice with industry-standard tools and frameworks"),
                explanation.advice());
        assertEquals("Your readiness for Data Engineer is good at 61.3%. Strong areas: Experience, Technical Skills. "
                + "Areas for improvement: Project Portfolio, Tool Proficiency.", explanation.summary());
    }

    @Test
    void neutralBandIsOmittedFromBothLists() {
        ScoreBreakdown breakdown = new ScoreBreakdown(60, List.of(
                factor(Factor.TECHNICAL_SKILL, 50), factor(Factor.EXPERIENCE, 69.9)));

        Explanation explanation = generator.explain("R", breakdown, gap(List.of()), new SkillGraph(), ReadinessSettings.DEFAULT);

        assertTrue(explanation.strengths().isEmpty());
        assertTrue(explanation.weaknesses().isEmpty());
        assertEquals(List.of("Continue building on your strong foundation"), explanation.advice());
    }

    @Test
    void ranksRecommendationsByWeightAndUnblockedSkills() {
        SkillGraph graph = new SkillGraph();
        for (String s : List.of("Linux", "Docker", "Kubernetes", "Podman", "Spark")) graph.addSkill(new Skill(s, "x", 2));
        graph.addPrerequisite("Docker", "Linux", Importance.REQUIRED);
        graph.addPrerequisite("Podman", "Linux", Importance.REQUIRED);
        graph.addPrerequisite("Kubernetes", "Docker", Importance.REQUIRED);

        GapReport gap = gap(List.of(missing("Spark", 2.0), missing("Docker", 1.0), missing("Linux", 1.0), missing("Kubernetes", 1.0)));
        List<Recommendation> recs = generator.recommend(gap, graph, 3);

        assertEquals(List.of("Linux", "Docker", "Spark"), recs.stream().map(Recommendation::skill).toList());
        assertEquals(3.0, recs.get(0).priority());
        assertEquals(2, recs.get(0).unblocks());
        assertEquals(1, recs.get(0).rank());
        assertEquals(3, recs.get(2).rank());
    }

    @Test
    void breaksRecommendationTiesByName() {
        GapReport gap = gap(List.of(missing("Zig", 1.0), missing("Ada", 1.0), missing("Nim", 1.0)));
        List<Recommendation> recs = generator.recommend(gap, new SkillGraph(), 10);

        assertEquals(List.of("Ada", "Nim", "Zig"), recs.stream().map(Recommendation::skill).toList());
    }

    @Test
    void technicalWeaknessAdviceNamesTopRecommendations() {
        ScoreBreakdown breakdown = new ScoreBreakdown(20, List.of(factor(Factor.TECHNICAL_SKILL, 20)));
        GapReport gap = gap(List.of(missing("Kafka", 1.0), missing("Spark", 2.0)));

        Explanation explanation = generator.explain("R", breakdown, gap, new SkillGraph(), ReadinessSettings.DEFAULT);

        assertEquals(List.of("Learn key skills: Spark, Kafka"), explanation.advice());
        assertEquals("Developing", explanation.readinessLevel());
    }

    @Test
    void degradesGracefullyOnEmptyInput() {
        Explanation explanation = assertDoesNotThrow(() -> generator.explain(null, null, null, null, null));

        assertTrue(explanation.strengths().isEmpty());
        assertTrue(explanation.weaknesses().isEmpty());
        assertTrue(explanation.recommendations().isEmpty());
        assertEquals("Developing", explanation.readinessLevel());
        assertTrue(generator.recommend(gap(List.of(missing("X", 1))), null, 0).isEmpty());
    }

    @Test
    void mapsScoresToReadinessLevels() {
        assertEquals("Excellent", generator.readinessLevel(80));
        assertEquals("Good", generator.readinessLevel(79.9));
        assertEquals("Moderate", generator.readinessLevel(40));
        assertEquals("Developing", generator.readinessLevel(0));
    }
}
