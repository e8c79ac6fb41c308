package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of a step-up challenge issued after a challenge decision")
public class ChallengeOutcome {

    @Schema(description = "User identifier", example = "USER-001")
    private String userId;

    @Schema(description = "Session identifier", example = "SESSION-0001")
    private String sessionId;

    @Schema(description = "Whether the user passed the challenge", example = "false")
    private boolean passed;
}
