package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Thresholds of one policy level, on the trust scale (1 - fused risk):
 * trust at or above allowThreshold allows, trust below blockThreshold blocks.
 * Invariant: blockThreshold < challengeThreshold < allowThreshold.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Trust-scale thresholds of a policy level")
public class PolicyThresholds {

    @Schema(description = "Minimum trust to allow", example = "0.75")
    private double allowThreshold;

    @Schema(description = "Trust below this challenges", example = "0.55")
    private double challengeThreshold;

    @Schema(description = "Trust below this blocks", example = "0.35")
    private double blockThreshold;

    public double allowRiskCutoff() {
        return 1.0 - allowThreshold;
    }

    public double challengeRiskCutoff() {
        return 1.0 - challengeThreshold;
    }

    public double blockRiskCutoff() {
        return 1.0 - blockThreshold;
    }

    public PolicyThresholds copy() {
        return new PolicyThresholds(allowThreshold, challengeThreshold, blockThreshold);
    }
}
