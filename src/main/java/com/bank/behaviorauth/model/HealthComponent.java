package com.bank.behaviorauth.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthComponent {
    VECTOR_STORE("vector_store"),
    SIMILARITY("similarity"),
    DRIFT("drift"),
    CONTEXT_SCORER("context_scorer"),
    GRAPH_SCORER("graph_scorer");

    private final String code;

    HealthComponent(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
