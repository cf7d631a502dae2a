package com.tokenpool.backend.token.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LimitReason {
    NONE(""),
    COOLDOWN("cooldown"),
    EXHAUSTED("exhausted");

    private final String code;

    LimitReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
