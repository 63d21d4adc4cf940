package com.skilllens.readiness.repository;

import com.skilllens.readiness.catalog.SkillCatalogProvider;
import com.skilllens.readiness.graph.SkillGraphModels.Importance;
import com.skilllens.readiness.graph.SkillGraphModels.PrerequisiteEdge;
import com.skilllens.readiness.graph.SkillGraphModels.Skill;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class SkillCatalogJdbcRepository implements SkillCatalogProvider {
    private final JdbcTemplate jdbcTemplate;

    public SkillCatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Skill> loadSkills() {
        return jdbcTemplate.query(
                "SELECT name, category, difficulty, estimated_weeks, demand FROM skills ORDER BY name",
                (rs, rowNum) -> new Skill(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4), rs.getInt(5)));
    }

    @Override
    public List<PrerequisiteEdge> loadPrerequisites() {
        return jdbcTemplate.query(
                "SELECT skill_name, prerequisite_name, importance FROM skill_prerequisites ORDER BY skill_name, prerequisite_name",
                (rs, rowNum) -> new PrerequisiteEdge(rs.getString(1), rs.getString(2), Importance.valueOf(rs.getString(3).toUpperCase())));
    }

    @Override
    public void saveSkill(Skill skill) {
        jdbcTemplate.update(
                "INSERT INTO skills(name, category, difficulty, estimated_weeks, demand) VALUES (?,?,?,?,?)",
                skill.name(), skill.category(), skill.difficulty(), skill.estimatedWeeks(), skill.demand());
    }

    @Override
    public void savePrerequisite(PrerequisiteEdge edge) {
        jdbcTemplate.update("DELETE FROM skill_prerequisites WHERE skill_name = ? AND prerequisite_name = ?",
                edge.skill(), edge.prerequisite());
        jdbcTemplate.update(
                "INSERT INTO skill_prerequisites(skill_name, prerequisite_name, importance) VALUES (?,?,?)",
                edge.skill(), edge.prerequisite(), edge.importance().name().toLowerCase());
    }
}
