package com.adaptivelimiter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConditionOperator {
    EQUALS,
    CONTAINS,
    MATCHES,
    IN,
    GREATER,
    LESS;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConditionOperator fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Condition operator is required");
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
