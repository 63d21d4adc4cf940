package com.skilllens.readiness.api;

import com.skilllens.readiness.catalog.RoleCatalogService;
import com.skilllens.readiness.catalog.SkillCatalogService;
import com.skilllens.readiness.domain.DomainModels;
import com.skilllens.readiness.domain.DomainModels.RoleRequirement;
import com.skilllens.readiness.gap.GapModels.GapReport;
import com.skilllens.readiness.graph.SkillGraphModels;
import com.skilllens.readiness.graph.SkillGraphModels.Importance;
import com.skilllens.readiness.graph.SkillGraphModels.PrerequisiteEdge;
import com.skilllens.readiness.graph.SkillGraphModels.Skill;
import com.skilllens.readiness.graph.SkillGraphModels.SkillDetails;
import com.skilllens.readiness.readiness.ReadinessService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api")
public class SkillController {
    private final SkillCatalogService skillCatalog;
    private final RoleCatalogService roleCatalog;
    private final ReadinessService readinessService;

    public SkillController(SkillCatalogService skillCatalog, RoleCatalogService roleCatalog, ReadinessService readinessService) {
        this.skillCatalog = skillCatalog;
        this.roleCatalog = roleCatalog;
        this.readinessService = readinessService;
    }

    @GetMapping("/roles")
    public ResponseEntity<List<String>> roles() {
        return ResponseEntity.ok(roleCatalog.titles());
    }

    @GetMapping("/roles/{title}")
    public ResponseEntity<RoleRequirement> role(@PathVariable String title) {
        return ResponseEntity.ok(roleCatalog.role(title));
    }

    @GetMapping("/skills")
    public ResponseEntity<SkillDetails> skill(@RequestParam String name) {
        return ResponseEntity.ok(skillCatalog.details(name));
    }

    @GetMapping("/skills/hierarchy")
    public ResponseEntity<Map<String, List<Skill>>> hierarchy() {
        return ResponseEntity.ok(skillCatalog.hierarchy());
    }

    @PostMapping("/skills")
    public ResponseEntity<Skill> addSkill(@RequestBody NewSkillRequest request) {
        int difficulty = request.difficulty() == null ? SkillGraphModels.DEFAULT_DIFFICULTY : request.difficulty();
        Skill skill = new Skill(request.name(), request.category(), difficulty,
                request.estimatedWeeks() == null ? difficulty : request.estimatedWeeks(),
                request.demand() == null ? 50 : request.demand());
        return ResponseEntity.status(HttpStatus.CREATED).body(skillCatalog.addSkill(skill));
    }

    @PostMapping("/skills/prerequisites")
    public ResponseEntity<PrerequisiteEdge> addPrerequisite(@RequestBody NewPrerequisiteRequest request) {
        Importance importance = request.importance() == null ? Importance.REQUIRED : request.importance();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(skillCatalog.addPrerequisite(request.skill(), request.prerequisite(), importance));
    }

    @PostMapping("/skills/gap")
    public ResponseEntity<GapReport> gap(@RequestBody GapRequest request) {
        Set<String> skills = DomainModels.names(request.skills(), "skill");
        return ResponseEntity.ok(readinessService.gap(skills, request.targetRole()));
    }

    public record NewSkillRequest(String name, String category, Integer difficulty, Integer estimatedWeeks, Integer demand) {}

    public record NewPrerequisiteRequest(String skill, String prerequisite, Importance importance) {}

    public record GapRequest(String targetRole, Set<String> skills) {}
}
