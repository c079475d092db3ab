package com.adaptivelimiter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RateLimitAlgorithm {
    TOKEN_BUCKET("token-bucket"),
    SLIDING_WINDOW("sliding-window"),
    FIXED_WINDOW("fixed-window"),
    ADAPTIVE("adaptive");

    private final String value;

    RateLimitAlgorithm(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    // accepts both the wire name (token-bucket) and the enum constant name (TOKEN_BUCKET)
    @JsonCreator
    public static RateLimitAlgorithm fromValue(String value) {
        if (value != null) {
            for (RateLimitAlgorithm algorithm : values()) {
                if (algorithm.value.equals(value) || algorithm.name().equals(value)) {
                    return algorithm;
                }
            }
        }
        throw new IllegalArgumentException("Unknown rate limit algorithm: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
