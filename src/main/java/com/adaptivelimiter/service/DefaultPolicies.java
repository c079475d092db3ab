package com.adaptivelimiter.service;

import com.adaptivelimiter.model.ConditionOperator;
import com.adaptivelimiter.model.PolicyCondition;
import com.adaptivelimiter.model.RateLimitAlgorithm;
import com.adaptivelimiter.model.RateLimitPolicy;

import java.util.List;

// tiered and endpoint policies registered at startup, in resolution tie-break order
public final class DefaultPolicies {

    private DefaultPolicies() {
    }

    public static List<RateLimitPolicy> all() {
        return List.of(
            RateLimitPolicy.builder()
                .name("free-tier")
                .algorithm(RateLimitAlgorithm.SLIDING_WINDOW)
                .limit(100)
                .window(3600)
                .condition(PolicyCondition.of("userTier", ConditionOperator.EQUALS, "free"))
                .build(),
            RateLimitPolicy.builder()
                .name("pro-tier")
                .algorithm(RateLimitAlgorithm.TOKEN_BUCKET)
                .limit(1000)
                .window(3600)
                .burst(50)
                .condition(PolicyCondition.of("userTier", ConditionOperator.EQUALS, "pro"))
                .build(),
            RateLimitPolicy.builder()
                .name("enterprise-tier")
                .algorithm(RateLimitAlgorithm.ADAPTIVE)
                .limit(10000)
                .window(3600)
                .burst(500)
                .condition(PolicyCondition.of("userTier", ConditionOperator.EQUALS, "enterprise"))
                .build(),
            RateLimitPolicy.builder()
                .name("api-heavy-endpoints")
                .algorithm(RateLimitAlgorithm.TOKEN_BUCKET)
                .limit(50)
                .window(60)
                .burst(10)
                .priority(10)
                .condition(PolicyCondition.of("path", ConditionOperator.IN,
                    List.of("/api/workflows/execute", "/api/ai/generate")))
                .build(),
            RateLimitPolicy.builder()
                .name("auth-endpoints")
                .algorithm(RateLimitAlgorithm.SLIDING_WINDOW)
                .limit(5)
                .window(300)
                .condition(PolicyCondition.of("path", ConditionOperator.CONTAINS, "/auth/"))
                .build(),
            RateLimitPolicy.builder()
                .name("anonymous-users")
                .algorithm(RateLimitAlgorithm.SLIDING_WINDOW)
                .limit(20)
                .window(3600)
                .condition(PolicyCondition.of("userId", ConditionOperator.EQUALS, null))
                .build()
        );
    }
}
