package com.bank.behaviorauth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuthDecision {
    ALLOW("allow"),
    CHALLENGE("challenge"),
    BLOCK("block");

    private final String code;

    AuthDecision(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AuthDecision fromCode(String code) {
        for (AuthDecision d : values()) {
            if (d.code.equalsIgnoreCase(code) || d.name().equalsIgnoreCase(code)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown decision: " + code);
    }
}
