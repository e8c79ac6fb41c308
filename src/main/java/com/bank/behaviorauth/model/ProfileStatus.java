package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Learning status of a user's behavioral profile")
public class ProfileStatus {

    @Schema(description = "User identifier", example = "USER-001")
    String userId;

    @Schema(description = "No history exists for this user", example = "false")
    boolean newUser;

    @Schema(description = "Current phase", example = "gradual_risk")
    LearningPhase phase;

    @Schema(description = "Distinct sessions analyzed", example = "7")
    long sessionCount;

    @Schema(description = "Sessions still needed to reach the next phase (0 in full_auth)", example = "8")
    long sessionsToNextPhase;

    @Schema(description = "Behavioral vectors currently stored", example = "7")
    int storedVectors;

    @Schema(description = "Whether a drift baseline has been established", example = "true")
    boolean driftBaselineEstablished;

    @Schema(description = "Epoch millis of the last baseline update, 0 if none", example = "1739886764000")
    long driftBaselineUpdatedAt;

    @Schema(description = "Failures recorded in the last hour", example = "1")
    int recentFailures;

    @Schema(description = "Epoch millis of the last phase transition", example = "1739886764000")
    long lastTransitionAt;
}
