package com.skilllens.readiness.repository;

import com.skilllens.readiness.catalog.RoleRequirementProvider;
import com.skilllens.readiness.domain.DomainModels.RoleRequirement;
import com.skilllens.readiness.domain.DomainModels.WeightedSkill;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.stream.Collectors;

@Repository
public class RoleJdbcRepository implements RoleRequirementProvider {
    private final JdbcTemplate jdbcTemplate;

    public RoleJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<RoleRequirement> loadRoles() {
        List<String> titles = jdbcTemplate.queryForList("SELECT title FROM roles ORDER BY title", String.class);

        Map<String, List<RoleSkillRow>> skillsByRole = jdbcTemplate.query(
                        "SELECT role_title, skill_name, weight, position FROM role_skills ORDER BY role_title, position",
                        (rs, rowNum) -> new RoleSkillRow(rs.getString(1), rs.getString(2), rs.getDouble(3), rs.getInt(4)))
                .stream()
                .collect(Collectors.groupingBy(RoleSkillRow::roleTitle, LinkedHashMap::new, Collectors.toList()));

        Map<String, Set<String>> toolsByRole = jdbcTemplate.query(
                        "SELECT role_title, tool_name FROM role_tools ORDER BY role_title, tool_name",
                        (rs, rowNum) -> new RoleToolRow(rs.getString(1), rs.getString(2)))
                .stream()
                .collect(Collectors.groupingBy(RoleToolRow::roleTitle,
                        Collectors.mapping(RoleToolRow::toolName, Collectors.toCollection(LinkedHashSet::new))));

        return titles.stream()
                .map(title -> new RoleRequirement(title,
                        skillsByRole.getOrDefault(title, List.of()).stream()
                                .map(r -> new WeightedSkill(r.skillName(), r.weight()))
                                .toList(),
                        toolsByRole.getOrDefault(title, Set.of())))
                .toList();
    }

    public record RoleSkillRow(String roleTitle, String skillName, double weight, int position) {}
    public record RoleToolRow(String roleTitle, String toolName) {}
}
