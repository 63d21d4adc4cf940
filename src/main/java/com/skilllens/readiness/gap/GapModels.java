package com.skilllens.readiness.gap;

import com.skilllens.readiness.graph.SkillGraphModels.Importance;

import java.util.List;

public class GapModels {
    public record GapReport(String targetRole,
                            List<String> matched,
                            List<MissingSkill> missingRequired,
                            List<MissingSkill> missingRecommended,
                            List<String> extraSkills) {
        public List<String> missingRequiredNames() {
            return missingRequired.stream().map(MissingSkill::skill).toList();
        }

        public List<String> missingRecommendedNames() {
            return missingRecommended.stream().map(MissingSkill::skill).toList();
        }
    }

    /**
     * @param direct    true when the role itself names the skill
     * @param neededFor directly missing role skills whose prerequisite closure contains this skill
     */
    public record MissingSkill(String skill, Importance importance, double weight, boolean direct, List<String> neededFor) {}
}
