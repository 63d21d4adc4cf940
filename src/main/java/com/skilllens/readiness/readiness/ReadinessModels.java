package com.skilllens.readiness.readiness;

import com.skilllens.readiness.explanation.ExplanationModels.Recommendation;
import com.skilllens.readiness.gap.GapModels.MissingSkill;
import com.skilllens.readiness.scoring.ScoringModels.FactorScore;

import java.util.List;

public class ReadinessModels {
    public record ReadinessResult(String targetRole,
                                  double overallScore,
                                  String readinessLevel,
                                  List<FactorScore> factors,
                                  List<String> matchedSkills,
                                  List<MissingSkill> missingRequired,
                                  List<MissingSkill> missingRecommended,
                                  List<String> extraSkills,
                                  List<String> strengths,
                                  List<String> weaknesses,
                                  List<Recommendation> recommendations,
                                  List<String> advice,
                                  String summary) {}
}
