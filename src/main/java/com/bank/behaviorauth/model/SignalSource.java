package com.bank.behaviorauth.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four independent risk signals fused into one score.
 *
 * Similarity-style signals carry "higher value = more like the user" and are
 * inverted before fusion; anomaly-style signals carry "higher value = riskier".
 */
public enum SignalSource {
    SIMILARITY("similarity", true, HealthComponent.SIMILARITY),
    DRIFT("drift", false, HealthComponent.DRIFT),
    CONTEXT("context", false, HealthComponent.CONTEXT_SCORER),
    GRAPH("graph", false, HealthComponent.GRAPH_SCORER);

    private final String code;
    private final boolean similarityStyle;
    private final HealthComponent component;

    SignalSource(String code, boolean similarityStyle, HealthComponent component) {
        this.code = code;
        this.similarityStyle = similarityStyle;
        this.component = component;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isSimilarityStyle() {
        return similarityStyle;
    }

    public HealthComponent getComponent() {
        return component;
    }

    /**
     * Map a signal value onto the risk axis: 1 - value for similarity, value otherwise.
     */
    public double toRiskDistance(double value) {
        return similarityStyle ? 1.0 - value : value;
    }
}
