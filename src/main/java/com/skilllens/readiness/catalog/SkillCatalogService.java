package com.skilllens.readiness.catalog;

import com.skilllens.readiness.error.ReadinessException;
import com.skilllens.readiness.error.UnknownSkillException;
import com.skilllens.readiness.graph.SkillGraph;
import com.skilllens.readiness.graph.SkillGraphModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Owns the process-wide {@link SkillGraph}. The catalog is read once at
 * startup; later additions are validated by the graph, persisted, and only then
 * published to readers.
 */
@Service
public class SkillCatalogService {
    private static final Logger log = LoggerFactory.getLogger(SkillCatalogService.class);
    private static final String UNCATEGORIZED = "Uncategorized";

    private final SkillCatalogProvider provider;
    private final SkillGraph graph = new SkillGraph();

    public SkillCatalogService(SkillCatalogProvider provider) {
        this.provider = provider;
        load();
    }

    private void load() {
        List<Skill> skills = provider.loadSkills();
        List<PrerequisiteEdge> edges = provider.loadPrerequisites();
        try {
            skills.forEach(graph::addSkill);
            edges.forEach(e -> graph.addPrerequisite(e.skill(), e.prerequisite(), e.importance()));
        } catch (ReadinessException e) {
            log.error("Skill catalog rejected during load [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        }
        log.info("Loaded skill catalog: {} skills, {} prerequisite edges", skills.size(), edges.size());
    }

    public SkillGraph graph() {
        return graph;
    }

    public Skill addSkill(Skill skill) {
        try {
            graph.addSkill(skill, () -> provider.saveSkill(skill));
        } catch (DataAccessException e) {
            log.error("Could not persist skill '{}', catalog left unchanged: {}", skill.name(), e.getMessage());
            throw e;
        }
        log.info("Registered skill '{}' [{}], difficulty {}", skill.name(), skill.category(), skill.difficulty());
        return skill;
    }

    public PrerequisiteEdge addPrerequisite(String skill, String prerequisite, Importance importance) {
        PrerequisiteEdge edge = new PrerequisiteEdge(skill, prerequisite, importance);
        try {
            graph.addPrerequisite(skill, prerequisite, importance, () -> provider.savePrerequisite(edge));
        } catch (ReadinessException e) {
            log.warn("Rejected prerequisite {} -> {}: {}", skill, prerequisite, e.getMessage());
            throw e;
        } catch (DataAccessException e) {
            log.error("Could not persist prerequisite {} -> {}, catalog left unchanged: {}", skill, prerequisite, e.getMessage());
            throw e;
        }
        log.info("Added prerequisite {} -> {} ({})", skill, prerequisite, importance);
        return edge;
    }

    /** Catalog skills grouped by category, each group ordered by difficulty then name. */
    public Map<String, List<Skill>> hierarchy() {
        Map<String, List<Skill>> byCategory = new TreeMap<>();
        for (Skill skill : graph.skills()) {
            String category = skill.category() == null ? UNCATEGORIZED : skill.category();
            byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(skill);
        }
        byCategory.values().forEach(skills -> skills.sort(Comparator.comparingInt(Skill::difficulty).thenComparing(Skill::name)));
        return byCategory;
    }

    public SkillDetails details(String name) {
        Skill skill = graph.skill(name).orElseThrow(() -> new UnknownSkillException(name));
        List<PrerequisiteEdge> direct = new ArrayList<>();
        graph.directPrerequisites(name).forEach((prereq, importance) -> direct.add(new PrerequisiteEdge(name, prereq, importance)));
        return new SkillDetails(skill,
                direct,
                graph.prerequisitesOf(name, true).stream().sorted().toList(),
                List.copyOf(graph.dependentsOf(name)),
                graph.enabledBy(name).stream().sorted().toList());
    }
}
