package com.skilllens.readiness.scoring;

import com.skilllens.readiness.config.ReadinessSettings;
import com.skilllens.readiness.domain.DomainModels.CandidateProfile;
import com.skilllens.readiness.domain.DomainModels.RoleRequirement;
import com.skilllens.readiness.error.InvalidWeightException;
import com.skilllens.readiness.gap.GapModels.GapReport;
import com.skilllens.readiness.scoring.ScoringModels.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ScoringEngine {

    public ScoreBreakdown score(GapReport gap, RoleRequirement role, CandidateProfile profile, ReadinessSettings settings) {
        Weights weights = settings.weights();
        double weightSum = weights.sum();
        if (weightSum <= 0) {
            throw new InvalidWeightException("At least one scoring weight must be positive");
        }

        List<FactorScore> factors = new ArrayList<>();
        factors.add(factor(Factor.TECHNICAL_SKILL, technicalScore(gap, role), weights, weightSum, technicalDetails(gap, role)));
        factors.add(factor(Factor.EXPERIENCE, saturating(profile.yearsOfExperience(), settings.experienceCeilingYears()), weights, weightSum,
                profile.yearsOfExperience() >= settings.experienceCeilingYears()
                        ? profile.yearsOfExperience() + " years of experience"
                        : profile.yearsOfExperience() + " years of experience (target: " + settings.experienceCeilingYears() + ")"));
        factors.add(factor(Factor.PROJECT, saturating(profile.projectCount(), settings.projectCeilingCount()), weights, weightSum,
                profile.projectCount() >= settings.projectCeilingCount()
                        ? profile.projectCount() + " projects in portfolio"
                        : profile.projectCount() + " projects (recommended: " + settings.projectCeilingCount() + ")"));
        factors.add(factor(Factor.TOOL, toolScore(profile, role), weights, weightSum, toolDetails(profile, role)));

        double overall = clamp(factors.stream().mapToDouble(FactorScore::contribution).sum());
        return new ScoreBreakdown(overall, List.copyOf(factors));
    }

    double technicalScore(GapReport gap, RoleRequirement role) {
        double total = role.totalWeight();
        if (total <= 0) return 100.0;
        double matched = gap.matched().stream().mapToDouble(role::weightOf).sum();
        return clamp(100.0 * matched / total);
    }

    double toolScore(CandidateProfile profile, RoleRequirement role) {
        if (role.relevantTools().isEmpty()) return 100.0;
        long present = role.relevantTools().stream().filter(profile.tools()::contains).count();
        return clamp(100.0 * present / role.relevantTools().size());
    }

    /** Linear up to {@code ceiling}, full credit at or above it. */
    double saturating(int value, int ceiling) {
        if (ceiling <= 0 || value >= ceiling) return 100.0;
        return clamp(100.0 * value / ceiling);
    }

    private FactorScore factor(Factor factor, double score, Weights weights, double weightSum, String details) {
        double weight = weights.of(factor) / weightSum;
        return new FactorScore(factor, score, weight, weight * score, details);
    }

    private String technicalDetails(GapReport gap, RoleRequirement role) {
        if (role.skills().isEmpty()) return "No specific skills required";
        return "Matched " + gap.matched().size() + "/" + role.skills().size() + " required skills";
    }

    private String toolDetails(CandidateProfile profile, RoleRequirement role) {
        if (role.relevantTools().isEmpty()) return "No specific tools required";
        long present = role.relevantTools().stream().filter(profile.tools()::contains).count();
        return "Proficient in " + present + "/" + role.relevantTools().size() + " required tools";
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }
}
