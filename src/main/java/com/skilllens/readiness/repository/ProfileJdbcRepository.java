package com.skilllens.readiness.repository;

import com.skilllens.readiness.catalog.ProfileProvider;
import com.skilllens.readiness.domain.DomainModels.CandidateProfile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

@Repository
public class ProfileJdbcRepository implements ProfileProvider {
    private final JdbcTemplate jdbcTemplate;

    public ProfileJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<CandidateProfile> findProfile(String candidateId) {
        List<CandidateRow> rows = jdbcTemplate.query(
                "SELECT candidate_id, years_of_experience, project_count FROM candidates WHERE candidate_id = ?",
                (rs, rowNum) -> new CandidateRow(rs.getString(1), rs.getInt(2), rs.getInt(3)),
                candidateId);
        if (rows.isEmpty()) return Optional.empty();

        CandidateRow row = rows.get(0);
        List<String> skills = jdbcTemplate.queryForList(
                "SELECT skill_name FROM candidate_skills WHERE candidate_id = ?", String.class, candidateId);
        List<String> tools = jdbcTemplate.queryForList(
                "SELECT tool_name FROM candidate_tools WHERE candidate_id = ?", String.class, candidateId);
        return Optional.of(new CandidateProfile(new HashSet<>(skills), row.yearsOfExperience(), row.projectCount(), new HashSet<>(tools)));
    }

    public record CandidateRow(String candidateId, int yearsOfExperience, int projectCount) {}
}
