package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * A user's position in the progressive-trust lifecycle. Immutable; the
 * PhaseManager replaces the whole value on every change.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Learning-phase state of a user")
public class LearningPhaseState {

    @Schema(description = "User identifier", example = "USER-001")
    String userId;

    @Schema(description = "Current phase", example = "learning")
    LearningPhase phase;

    @Schema(description = "Distinct sessions analyzed so far", example = "3")
    long sessionCount;

    @Schema(description = "Last session counted toward sessionCount", example = "SESSION-0003")
    String lastSessionId;

    @Schema(description = "Epoch millis of the last phase transition", example = "1739886764000")
    long lastTransitionAt;

    @Schema(description = "Epoch millis when the user was first seen", example = "1739800000000")
    long createdAt;

    /**
     * Fully-populated state for a user with no history.
     */
    public static LearningPhaseState newUser(String userId, long now) {
        return LearningPhaseState.builder()
                .userId(userId)
                .phase(LearningPhase.COLD_START)
                .sessionCount(0)
                .lastSessionId(null)
                .lastTransitionAt(now)
                .createdAt(now)
                .build();
    }

    public boolean isNewUser() {
        return phase == LearningPhase.COLD_START && sessionCount == 0;
    }
}
