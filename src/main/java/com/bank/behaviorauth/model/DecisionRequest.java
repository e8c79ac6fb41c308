package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Behavioral telemetry of a session submitted for an authentication decision")
public class DecisionRequest {

    @Schema(description = "User identifier", example = "USER-001")
    private String userId;

    @Schema(description = "Session identifier", example = "SESSION-0001")
    private String sessionId;

    @Schema(description = "Feature-extracted behavioral vector (90 values). Null or all-zero means no telemetry.")
    private float[] behavioralVector;

    @Schema(description = "Session UI event graph for the graph-anomaly model")
    private SessionGraph sessionGraph;

    @Schema(description = "Context features for the context encoder", example = "{\"hour_of_day\": 0.54, \"network_change\": 0.0}")
    @Builder.Default
    private Map<String, Double> contextFeatures = new HashMap<>();

    @Schema(description = "Amount of the transaction being authorized, if any", example = "25000.00")
    private Double transactionAmount;

    @Schema(description = "Device integrity attestation result (false = rooted/tampered)", example = "true")
    @Builder.Default
    private boolean deviceIntegrityOk = true;

    /**
     * A request without usable telemetry. Scored, but never fed back into user state.
     */
    public boolean isEmptySession() {
        if (behavioralVector == null || behavioralVector.length == 0) return true;
        for (float v : behavioralVector) {
            if (v != 0.0f) return false;
        }
        return true;
    }
}
