package com.bank.behaviorauth.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PolicyLevel {
    LEVEL_1("level_1"),
    LEVEL_2("level_2"),
    LEVEL_3("level_3"),
    LEVEL_4("level_4");

    private final String code;

    PolicyLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PolicyLevel fromCode(String code) {
        for (PolicyLevel level : values()) {
            if (level.code.equalsIgnoreCase(code) || level.name().equalsIgnoreCase(code)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown policy level: " + code);
    }
}
