package com.bank.behaviorauth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progressive-trust lifecycle of a user. Declaration order is the only
 * allowed direction of travel.
 */
public enum LearningPhase {
    COLD_START("cold_start", false),
    LEARNING("learning", false),
    GRADUAL_RISK("gradual_risk", true),
    FULL_AUTH("full_auth", true);

    private final String code;
    private final boolean riskEnforced;

    LearningPhase(String code, boolean riskEnforced) {
        this.code = code;
        this.riskEnforced = riskEnforced;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Whether fused risk may produce challenge/block decisions in this phase.
     */
    public boolean isRiskEnforced() {
        return riskEnforced;
    }

    public boolean isAfter(LearningPhase other) {
        return ordinal() > other.ordinal();
    }

    public static LearningPhase max(LearningPhase a, LearningPhase b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    @JsonCreator
    public static LearningPhase fromCode(String code) {
        for (LearningPhase p : values()) {
            if (p.code.equalsIgnoreCase(code) || p.name().equalsIgnoreCase(code)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown learning phase: " + code);
    }
}
