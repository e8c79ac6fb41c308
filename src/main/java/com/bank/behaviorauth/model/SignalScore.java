package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@Schema(description = "A single risk signal produced for one decision request")
public class SignalScore {

    public static final double NEUTRAL_VALUE = 0.5;

    @Schema(description = "Signal source", example = "similarity")
    SignalSource source;

    @Schema(description = "Signal value in [0,1]", example = "0.91")
    double value;

    @Schema(description = "Confidence in the value, in [0,1]", example = "1.0")
    double confidence;

    @Schema(description = "Produced under fallback conditions (insufficient data or scorer unavailable)", example = "false")
    boolean degraded;

    @Schema(description = "Raised when the signal crossed its alert threshold", example = "false")
    boolean alert;

    @Schema(description = "Human-readable detail used in the decision explanation", example = "tier=HIGH best=0.912 over 5 matches")
    String detail;

    public static SignalScore of(SignalSource source, double value, double confidence, String detail) {
        return SignalScore.builder()
                .source(source)
                .value(clamp(value))
                .confidence(clamp(confidence))
                .degraded(false)
                .detail(detail)
                .build();
    }

    /**
     * Neutral fallback: value 0.5, confidence 0, so fusion gives it no weight.
     */
    public static SignalScore degraded(SignalSource source, String reason) {
        return SignalScore.builder()
                .source(source)
                .value(NEUTRAL_VALUE)
                .confidence(0.0)
                .degraded(true)
                .detail(reason)
                .build();
    }

    public static double clamp(double v) {
        if (Double.isNaN(v)) return NEUTRAL_VALUE;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
