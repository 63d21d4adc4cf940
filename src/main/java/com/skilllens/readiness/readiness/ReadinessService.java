package com.skilllens.readiness.readiness;

import com.skilllens.readiness.catalog.ProfileProvider;
import com.skilllens.readiness.catalog.RoleCatalogService;
import com.skilllens.readiness.catalog.SkillCatalogService;
import com.skilllens.readiness.config.ReadinessProperties;
import com.skilllens.readiness.config.ReadinessSettings;
import com.skilllens.readiness.domain.DomainModels.CandidateProfile;
import com.skilllens.readiness.domain.DomainModels.RoleRequirement;
import com.skilllens.readiness.error.UnknownCandidateException;
import com.skilllens.readiness.explanation.ExplanationGenerator;
import com.skilllens.readiness.explanation.ExplanationModels.Explanation;
import com.skilllens.readiness.gap.GapAnalyzer;
import com.skilllens.readiness.gap.GapModels.GapReport;
import com.skilllens.readiness.gap.GapModels.MissingSkill;
import com.skilllens.readiness.graph.SkillGraph;
import com.skilllens.readiness.path.LearningPathModels.LearningPath;
import com.skilllens.readiness.path.LearningPathPlanner;
import com.skilllens.readiness.readiness.ReadinessModels.ReadinessResult;
import com.skilllens.readiness.scoring.ScoringEngine;
import com.skilllens.readiness.scoring.ScoringModels.ScoreBreakdown;
import com.skilllens.readiness.scoring.ScoringModels.Weights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Service
public class ReadinessService {
    private static final Logger log = LoggerFactory.getLogger(ReadinessService.class);

    private final SkillCatalogService skillCatalog;
    private final RoleCatalogService roleCatalog;
    private final ProfileProvider profiles;
    private final GapAnalyzer gapAnalyzer;
    private final ScoringEngine scoringEngine;
    private final ExplanationGenerator explanationGenerator;
    private final LearningPathPlanner planner;
    private final ReadinessSettings defaults;

    public ReadinessService(SkillCatalogService skillCatalog,
                            RoleCatalogService roleCatalog,
                            ProfileProvider profiles,
                            GapAnalyzer gapAnalyzer,
                            ScoringEngine scoringEngine,
                            ExplanationGenerator explanationGenerator,
                            LearningPathPlanner planner,
                            ReadinessProperties properties) {
        this.skillCatalog = skillCatalog;
        this.roleCatalog = roleCatalog;
        this.profiles = profiles;
        this.gapAnalyzer = gapAnalyzer;
        this.scoringEngine = scoringEngine;
        this.explanationGenerator = explanationGenerator;
        this.planner = planner;
        this.defaults = properties.toSettings();
    }

    public ReadinessSettings defaults() {
        return defaults;
    }

    public ReadinessResult assess(CandidateProfile profile, String roleTitle, Weights weightOverride) {
        ReadinessSettings settings = weightOverride == null ? defaults : defaults.withWeights(weightOverride);
        return assess(profile, roleCatalog.role(roleTitle), settings);
    }

    public ReadinessResult assessCandidate(String candidateId, String roleTitle) {
        CandidateProfile profile = profiles.findProfile(candidateId)
                .orElseThrow(() -> new UnknownCandidateException(candidateId));
        return assess(profile, roleCatalog.role(roleTitle), defaults);
    }

    public ReadinessResult assess(CandidateProfile profile, RoleRequirement role, ReadinessSettings settings) {
        SkillGraph graph = skillCatalog.graph();
        GapReport gap = gapAnalyzer.analyze(profile.skills(), role, graph);
        ScoreBreakdown breakdown = scoringEngine.score(gap, role, profile, settings);
        Explanation explanation = explanationGenerator.explain(role.title(), breakdown, gap, graph, settings);

        log.debug("Assessed readiness for '{}': overall={} matched={} missingRequired={}",
                role.title(), breakdown.overallScore(), gap.matched().size(), gap.missingRequired().size());

        return new ReadinessResult(role.title(),
                breakdown.overallScore(),
                explanation.readinessLevel(),
                breakdown.factors(),
                gap.matched(),
                gap.missingRequired(),
                gap.missingRecommended(),
                gap.extraSkills(),
                explanation.strengths(),
                explanation.weaknesses(),
                explanation.recommendations(),
                explanation.advice(),
                explanation.summary());
    }

    public GapReport gap(Set<String> skills, String roleTitle) {
        return gapAnalyzer.analyze(skills, roleCatalog.role(roleTitle), skillCatalog.graph());
    }

    public LearningPath learningPath(Set<String> skills, String roleTitle, boolean includeRecommended) {
        GapReport gap = gap(skills, roleTitle);
        return learningPath(gap, skills, includeRecommended);
    }

    public LearningPath learningPath(GapReport gap, Set<String> knownSkills, boolean includeRecommended) {
        List<String> targets = new ArrayList<>(gap.missingRequiredNames());
        if (includeRecommended) {
            gap.missingRecommended().stream().map(MissingSkill::skill).forEach(targets::add);
        }
        return planner.plan(gap.targetRole(), targets, knownSkills, skillCatalog.graph());
    }
}
