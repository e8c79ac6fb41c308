package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Emitted authentication decision. Never mutated after creation; it is also
 * the audit record persisted for every request.
 */
@Value
@Builder
@Schema(description = "Authentication decision with fused risk and explainable per-signal breakdown")
public class DecisionRecord {

    @Schema(description = "Decision identifier", example = "7d0f8a52-1c55-4a7e-9c53-1f0e3b1d2a44")
    String decisionId;

    @Schema(description = "User identifier", example = "USER-001")
    String userId;

    @Schema(description = "Session identifier", example = "SESSION-0001")
    String sessionId;

    @Schema(description = "Final decision", example = "challenge", allowableValues = {"allow", "challenge", "block"})
    AuthDecision decision;

    @Schema(description = "Fused risk score in [0,1]", example = "0.48")
    double fusedRisk;

    @Schema(description = "User's learning phase when the decision was made", example = "full_auth")
    LearningPhase phase;

    @Schema(description = "Policy level applied, null while risk is not enforced", example = "level_2")
    PolicyLevel policyLevel;

    @Schema(description = "Decision rule that fired", example = "UNCERTAIN_BAND")
    PolicyRule ruleFired;

    @Schema(description = "Per-signal breakdown keyed by similarity, drift, context, graph")
    Map<String, SignalContribution> breakdown;

    @Schema(description = "Signals produced under fallback conditions", example = "[\"context\"]")
    List<String> degradedSources;

    @Schema(description = "Human-readable explanation referencing the breakdown and rule",
            example = "rule=UNCERTAIN_BAND level=level_2 risk=0.480 (allow<=0.250, challenge>=0.450, block>=0.650)")
    String explanation;

    @Schema(description = "Decision timestamp in epoch millis", example = "1739886764000")
    long decidedAt;

    @Schema(description = "Pipeline latency in millis", example = "18")
    long latencyMs;
}
