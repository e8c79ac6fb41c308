package com.bank.behaviorauth.controller;

import com.bank.behaviorauth.exception.ValidationException;
import com.bank.behaviorauth.model.ChallengeOutcome;
import com.bank.behaviorauth.model.DecisionRecord;
import com.bank.behaviorauth.model.DecisionRequest;
import com.bank.behaviorauth.model.PagedResponse;
import com.bank.behaviorauth.repository.DecisionAuditRepository;
import com.bank.behaviorauth.service.AuthenticationDecisionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "Decide sessions from behavioral telemetry and browse the decision audit trail")
public class AuthDecisionController {

    private final AuthenticationDecisionService decisionService;
    private final DecisionAuditRepository auditRepository;

    public AuthDecisionController(AuthenticationDecisionService decisionService,
                                  DecisionAuditRepository auditRepository) {
        this.decisionService = decisionService;
        this.auditRepository = auditRepository;
    }

    @Operation(summary = "Decide a session",
            description = "Scores the session's behavioral vector, drift, context and session graph against the " +
                    "user's history, fuses them into one risk score and returns allow / challenge / block " +
                    "with the per-signal breakdown and the rule that fired. Unavailable signals are reported " +
                    "as degraded rather than failing the request.")
    @PostMapping("/decide")
    public ResponseEntity<DecisionRecord> decide(@RequestBody DecisionRequest request) {
        return ResponseEntity.ok(decisionService.decide(request));
    }

    @Operation(summary = "Report a step-up challenge result",
            description = "A failed challenge counts toward the user's lockout threshold.")
    @PostMapping("/challenge-outcome")
    public ResponseEntity<Map<String, Object>> challengeOutcome(@RequestBody ChallengeOutcome outcome) {
        int recentFailures = decisionService.recordChallengeOutcome(outcome);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", outcome.getUserId());
        body.put("sessionId", outcome.getSessionId());
        body.put("passed", outcome.isPassed());
        body.put("recentFailures", recentFailures);
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Get a decision by ID")
    @GetMapping("/decisions/{decisionId}")
    public ResponseEntity<DecisionRecord> getDecision(
            @Parameter(description = "Decision ID", example = "7d0f8a52-1c55-4a7e-9c53-1f0e3b1d2a44")
            @PathVariable String decisionId) {
        DecisionRecord record = auditRepository.findByDecisionId(decisionId);
        if (record == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(record);
    }

    @Operation(summary = "List decisions by user ID",
            description = "Retrieves the user's recent decisions, newest first. Supports cursor-based pagination.")
    @GetMapping("/decisions/user/{userId}")
    public ResponseEntity<PagedResponse<DecisionRecord>> getDecisionsByUser(
            @Parameter(description = "User ID", example = "USER-001")
            @PathVariable String userId,
            @Parameter(description = "Max number of decisions to return", example = "20")
            @RequestParam(defaultValue = "20") int limit,
            @Parameter(description = "Cursor: return records with decidedAt before this value")
            @RequestParam(required = false) Long before) {
        if (limit < 1) {
            throw new ValidationException("limit", "limit must be at least 1");
        }
        return ResponseEntity.ok(auditRepository.findByUserId(userId, limit, before));
    }
}
