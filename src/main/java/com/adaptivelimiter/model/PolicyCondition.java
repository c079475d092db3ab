package com.adaptivelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;

/**
 * A single predicate evaluated against a field resolved from the request.
 * <p>
 * Supported fields: {@code userId, apiKey, ip, path, method, userAgent, origin, userTier},
 * {@code header.<name>} and {@code metadata.<key>}. Any other name is looked up in the
 * request metadata as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyCondition {
    private String field;
    private ConditionOperator operator;
    // String, Number, Boolean, a list of those, or null
    private Object value;

    public static PolicyCondition of(String field, ConditionOperator operator, Object value) {
        return new PolicyCondition(field, operator, value);
    }

    // list values are copied too; scalars are immutable
    public PolicyCondition copy() {
        Object copiedValue = value instanceof Collection ? new ArrayList<>((Collection<?>) value) : value;
        return new PolicyCondition(field, operator, copiedValue);
    }
}
