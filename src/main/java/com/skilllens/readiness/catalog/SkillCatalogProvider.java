package com.skilllens.readiness.catalog;

import com.skilllens.readiness.graph.SkillGraphModels.PrerequisiteEdge;
import com.skilllens.readiness.graph.SkillGraphModels.Skill;

import java.util.List;

public interface SkillCatalogProvider {
    List<Skill> loadSkills();

    List<PrerequisiteEdge> loadPrerequisites();

    void saveSkill(Skill skill);

    void savePrerequisite(PrerequisiteEdge edge);
}
