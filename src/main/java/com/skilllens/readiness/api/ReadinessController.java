package com.skilllens.readiness.api;

import com.skilllens.readiness.domain.DomainModels;
import com.skilllens.readiness.domain.DomainModels.CandidateProfile;
import com.skilllens.readiness.path.LearningPathModels.LearningPath;
import com.skilllens.readiness.readiness.ReadinessModels.ReadinessResult;
import com.skilllens.readiness.readiness.ReadinessService;
import com.skilllens.readiness.scoring.ScoringModels.Weights;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

@RestController
@RequestMapping("/api")
public class ReadinessController {
    private final ReadinessService readinessService;

    public ReadinessController(ReadinessService readinessService) {
        this.readinessService = readinessService;
    }

    @PostMapping("/readiness")
    public ResponseEntity<ReadinessResult> assess(@RequestBody AssessRequest request) {
        CandidateProfile profile = new CandidateProfile(request.skills(),
                request.yearsOfExperience(), request.projectCount(), request.tools());
        return ResponseEntity.ok(readinessService.assess(profile, request.targetRole(), request.weights()));
    }

    @GetMapping("/readiness/candidates/{candidateId}")
    public ResponseEntity<ReadinessResult> assessCandidate(@PathVariable String candidateId, @RequestParam String role) {
        return ResponseEntity.ok(readinessService.assessCandidate(candidateId, role));
    }

    @PostMapping("/learning-path")
    public ResponseEntity<LearningPath> learningPath(@RequestBody PathRequest request) {
        Set<String> skills = DomainModels.names(request.skills(), "skill");
        return ResponseEntity.ok(readinessService.learningPath(skills, request.targetRole(), request.includeRecommended()));
    }

    public record AssessRequest(String targetRole,
                                Set<String> skills,
                                int yearsOfExperience,
                                int projectCount,
                                Set<String> tools,
                                Weights weights) {}

    public record PathRequest(String targetRole, Set<String> skills, boolean includeRecommended) {}
}
