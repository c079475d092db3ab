package com.adaptivelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitPolicy {
    private String name;
    private RateLimitAlgorithm algorithm;

    // max requests per window
    private Integer limit;
    // window length in seconds
    private Integer window;

    // extra allowance, only used by token bucket
    private Integer burst;

    // higher wins; absent counts as 0
    private Integer priority;

    @Singular
    private List<PolicyCondition> conditions;
    @Singular
    private List<PolicyOverride> overrides;

    // detached from the caller's condition and override objects
    public RateLimitPolicy copy() {
        RateLimitPolicyBuilder builder = toBuilder().clearConditions().clearOverrides();
        if (conditions != null) {
            conditions.forEach(condition -> builder.condition(condition != null ? condition.copy() : null));
        }
        if (overrides != null) {
            overrides.forEach(override -> builder.override(override != null ? override.copy() : null));
        }
        return builder.build();
    }

    public int effectivePriority() {
        return priority != null ? priority : 0;
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Policy name must not be blank");
        }
        if (algorithm == null) {
            throw new IllegalArgumentException("Policy algorithm is required");
        }
        if (limit == null || limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (window == null || window <= 0) {
            throw new IllegalArgumentException("Window must be positive");
        }
        if (burst != null && burst <= 0) {
            throw new IllegalArgumentException("Burst must be positive when set");
        }
        if (conditions != null) {
            for (PolicyCondition condition : conditions) {
                validateCondition(condition);
            }
        }
        if (overrides != null) {
            for (PolicyOverride override : overrides) {
                if (override == null) {
                    throw new IllegalArgumentException("Override must not be null");
                }
                validateCondition(override.getCondition());
                if (override.getLimit() != null && override.getLimit() <= 0) {
                    throw new IllegalArgumentException("Override limit must be positive");
                }
                if (override.getWindow() != null && override.getWindow() <= 0) {
                    throw new IllegalArgumentException("Override window must be positive");
                }
            }
        }
    }

    public String getDescription() {
        return switch (algorithm) {
            case TOKEN_BUCKET ->
                String.format("Token Bucket: %d per %ds, burst %s", limit, window,
                    burst != null ? burst : limit);
            case SLIDING_WINDOW ->
                String.format("Sliding Window: %d requests per %ds", limit, window);
            case FIXED_WINDOW ->
                String.format("Fixed Window: %d requests per %ds window", limit, window);
            case ADAPTIVE ->
                String.format("Adaptive: base %d requests per %ds", limit, window);
        };
    }

    private static void validateCondition(PolicyCondition condition) {
        if (condition == null || condition.getField() == null || condition.getField().isBlank()) {
            throw new IllegalArgumentException("Condition field must not be blank");
        }
        if (condition.getOperator() == null) {
            throw new IllegalArgumentException("Condition operator is required for field " + condition.getField());
        }
    }
}
