package com.adaptivelimiter.service;

import com.adaptivelimiter.algorithm.FixedWindowLimiter;
import com.adaptivelimiter.algorithm.SlidingWindowLimiter;
import com.adaptivelimiter.algorithm.TokenBucketLimiter;
import com.adaptivelimiter.dto.CheckStatus;
import com.adaptivelimiter.dto.RateLimitRequest;
import com.adaptivelimiter.dto.RateLimitResult;
import com.adaptivelimiter.model.ConditionOperator;
import com.adaptivelimiter.model.PolicyCondition;
import com.adaptivelimiter.model.PolicyOverride;
import com.adaptivelimiter.model.RateLimitAlgorithm;
import com.adaptivelimiter.model.RateLimitPolicy;
import com.adaptivelimiter.model.SystemLoad;
import com.adaptivelimiter.model.UserBehavior;
import com.adaptivelimiter.store.CounterStore;
import com.adaptivelimiter.store.LocalCounterStore;
import com.adaptivelimiter.store.StoreUnavailableException;
import com.adaptivelimiter.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AdaptiveRateLimiterTest {

    // aligned to an hour boundary
    private static final long START = 1_699_999_200_000L;

    private MutableClock clock;
    private PolicyRegistry registry;
    private PolicyMatcher policyMatcher;
    private SimpleMeterRegistry meterRegistry;
    private AdaptiveRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(START);
        registry = new PolicyRegistry();
        registry.init();
        policyMatcher = new PolicyMatcher();
        meterRegistry = new SimpleMeterRegistry();
        rateLimiter = newRateLimiter(new LocalCounterStore(clock, 250, 10_000));
    }

    private AdaptiveRateLimiter newRateLimiter(CounterStore store) {
        MetricsService metrics = new MetricsService(meterRegistry);
        return new AdaptiveRateLimiter(
                registry,
                policyMatcher,
                new TokenBucketLimiter(store, clock),
                new SlidingWindowLimiter(store, clock),
                new FixedWindowLimiter(store, clock),
                new AdaptiveLimitCalculator(),
                new LoadSignalService(store),
                new AdaptiveDecisionRecorder(store, new ObjectMapper().findAndRegisterModules(), metrics),
                metrics,
                clock);
    }

    private static RateLimitRequest tierRequest(String userId, String tier, String path) {
        return RateLimitRequest.builder()
                .userId(userId)
                .ip("203.0.113.7")
                .path(path)
                .method("GET")
                .metadata(Map.of("userTier", tier))
                .build();
    }

    @Test
    void proTierShouldUseBurstThenDenyWithRetryAfter() {
        // Given
        RateLimitRequest request = tierRequest("u1", "pro", "/api/workflows");

        // When
        RateLimitResult first = rateLimiter.checkRateLimit(request);

        // Then
        assertThat(first.isAllowed()).isTrue();
        assertThat(first.getPolicy()).isEqualTo("pro-tier");
        assertThat(first.getLimit()).isEqualTo(1000);
        assertThat(first.getRemaining()).isEqualTo(49);
        assertThat(first.getRetryAfter()).isNull();
        assertThat(first.getHeaders())
                .containsEntry("X-RateLimit-Policy", "pro-tier")
                .containsEntry("X-RateLimit-Limit", "1000")
                .containsEntry("X-RateLimit-Remaining", "49")
                .containsEntry("X-RateLimit-Algorithm", "token-bucket")
                .containsKey("X-RateLimit-Reset")
                .doesNotContainKey("Retry-After");

        RateLimitResult last = first;
        for (int i = 2; i <= 50; i++) {
            last = rateLimiter.checkRateLimit(request);
        }
        assertThat(last.isAllowed()).isTrue();
        assertThat(last.getRemaining()).isZero();

        // 1000 per hour refills one token every 4 seconds
        RateLimitResult denied = rateLimiter.checkRateLimit(request);
        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getRetryAfter()).isEqualTo(4);
        assertThat(denied.getHeaders()).containsEntry("Retry-After", "4");
    }

    @Test
    void higherPriorityPolicyShouldWinOverTier() {
        // When
        RateLimitResult result = rateLimiter.checkRateLimit(tierRequest("u1", "free", "/api/ai/generate"));

        // Then
        assertThat(result.getPolicy()).isEqualTo("api-heavy-endpoints");
        assertThat(result.getRemaining()).isEqualTo(9);
    }

    @Test
    void endpointPoliciesShouldBeKeyedPerPath() {
        // Given
        RateLimitPolicy heavy = registry.get("api-heavy-endpoints").orElseThrow();

        // Then
        assertThat(rateLimiter.generateKey(tierRequest("u1", "free", "/api/ai/generate"), heavy))
                .isEqualTo("api-heavy-endpoints:user:u1:/api/ai/generate");
        assertThat(rateLimiter.generateKey(tierRequest("u1", "free", "/x"), registry.get("free-tier").orElseThrow()))
                .isEqualTo("free-tier:user:u1");
    }

    @Test
    void keyShouldPreferUserThenApiKeyThenIp() {
        RateLimitPolicy policy = registry.get("free-tier").orElseThrow();

        assertThat(rateLimiter.generateKey(RateLimitRequest.builder().apiKey("k1").ip("1.1.1.1").build(), policy))
                .isEqualTo("free-tier:key:k1");
        assertThat(rateLimiter.generateKey(RateLimitRequest.builder().ip("1.1.1.1").build(), policy))
                .isEqualTo("free-tier:ip:1.1.1.1");
    }

    @Test
    void anonymousRequestShouldResolveToAnonymousPolicy() {
        // When
        RateLimitResult result = rateLimiter.checkRateLimit(
                RateLimitRequest.builder().ip("198.51.100.1").path("/home").build());

        // Then
        assertThat(result.getPolicy()).isEqualTo("anonymous-users");
        assertThat(result.getLimit()).isEqualTo(20);
        assertThat(result.getRemaining()).isEqualTo(19);
    }

    @Test
    void unmatchedRequestShouldUseDefaultPolicy() {
        // When
        RateLimitResult result = rateLimiter.checkRateLimit(
                RateLimitRequest.builder().userId("u9").ip("198.51.100.1").path("/home").build());

        // Then
        assertThat(result.getPolicy()).isEqualTo("default");
        assertThat(result.getLimit()).isEqualTo(100);
        assertThat(result.getHeaders()).containsEntry("X-RateLimit-Algorithm", "sliding-window");
    }

    @Test
    void overrideShouldReplaceLimitWindowAndAlgorithmButKeepName() {
        // Given
        rateLimiter.addPolicy(RateLimitPolicy.builder()
                .name("partner")
                .algorithm(RateLimitAlgorithm.SLIDING_WINDOW)
                .limit(100)
                .window(3600)
                .priority(100)
                .condition(PolicyCondition.of("header.x-partner", ConditionOperator.EQUALS, "acme"))
                .override(PolicyOverride.builder()
                        .condition(PolicyCondition.of("method", ConditionOperator.EQUALS, "POST"))
                        .limit(2)
                        .window(60)
                        .algorithm("fixed-window")
                        .build())
                .build());
        RateLimitRequest post = RateLimitRequest.builder()
                .ip("192.0.2.10")
                .method("POST")
                .header("x-partner", "acme")
                .build();

        // When
        RateLimitResult first = rateLimiter.checkRateLimit(post);
        rateLimiter.checkRateLimit(post);
        RateLimitResult third = rateLimiter.checkRateLimit(post);

        // Then
        assertThat(first.getPolicy()).isEqualTo("partner");
        assertThat(first.getLimit()).isEqualTo(2);
        assertThat(first.getHeaders()).containsEntry("X-RateLimit-Algorithm", "fixed-window");
        assertThat(third.isAllowed()).isFalse();
        assertThat(third.getRetryAfter()).isEqualTo(60);
        assertThat(rateLimiter.getPolicy("partner"))
                .hasValueSatisfying(p -> assertThat(p.getLimit()).isEqualTo(100));
    }

    @Test
    void unknownOverrideAlgorithmShouldFailOpen() {
        // Given
        rateLimiter.addPolicy(RateLimitPolicy.builder()
                .name("broken")
                .algorithm(RateLimitAlgorithm.FIXED_WINDOW)
                .limit(1)
                .window(60)
                .priority(100)
                .override(PolicyOverride.builder()
                        .condition(PolicyCondition.of("ip", ConditionOperator.EQUALS, "192.0.2.11"))
                        .algorithm("leaky-bucket")
                        .build())
                .build());

        // When
        RateLimitResult result = rateLimiter.checkRateLimit(RateLimitRequest.builder().ip("192.0.2.11").build());

        // Then
        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getPolicy()).isEqualTo("fallback");
        assertThat(result.getStatus()).isEqualTo(CheckStatus.DEGRADED);
        assertThat(meterRegistry.counter("ratelimit.errors").count()).isEqualTo(1.0);
    }

    @Test
    void adaptivePolicyShouldScaleLimitFromSignals() {
        // Given
        rateLimiter.updateUserBehavior("u2", UserBehavior.builder()
                .errorRate(0.001).avgResponseTime(50.0).consistency(0.95).reputation(1.0).build());
        rateLimiter.updateSystemLoad(SystemLoad.builder().cpu(20.0).errorRate(0.001).build());

        // When
        RateLimitResult result = rateLimiter.checkRateLimit(tierRequest("u2", "enterprise", "/api/data"));

        // Then: clamped to 3x, reported limit stays the base limit
        assertThat(result.getPolicy()).isEqualTo("enterprise-tier");
        assertThat(result.getLimit()).isEqualTo(10_000);
        assertThat(result.getRemaining()).isEqualTo(29_999);
        assertThat(meterRegistry.counter("ratelimit.adaptive.decisions", "result", "allowed").count())
                .isEqualTo(1.0);
    }

    @Test
    void adaptivePolicyShouldThrottlePoorBehavior() {
        // Given
        rateLimiter.addPolicy(RateLimitPolicy.builder()
                .name("adaptive-small")
                .algorithm(RateLimitAlgorithm.ADAPTIVE)
                .limit(10)
                .window(60)
                .priority(50)
                .condition(PolicyCondition.of("userId", ConditionOperator.EQUALS, "u3"))
                .build());
        rateLimiter.updateUserBehavior("u3", UserBehavior.builder()
                .errorRate(0.3).avgResponseTime(900.0).burstiness(0.95).reputation(0.0).build());
        rateLimiter.updateSystemLoad(SystemLoad.builder().cpu(95.0).errorRate(0.2).build());
        RateLimitRequest request = RateLimitRequest.builder().userId("u3").ip("192.0.2.12").build();

        // When
        RateLimitResult first = rateLimiter.checkRateLimit(request);
        RateLimitResult second = rateLimiter.checkRateLimit(request);

        // Then: 10 * 0.1 leaves a single request per window
        assertThat(first.isAllowed()).isTrue();
        assertThat(second.isAllowed()).isFalse();
        assertThat(second.getRetryAfter()).isPositive();
    }

    @Test
    void storeOutageShouldFailOpenAndBeCounted() {
        // Given
        CounterStore brokenStore = mock(CounterStore.class);
        when(brokenStore.execute(any(), anyList(), anyList()))
                .thenThrow(new StoreUnavailableException("connection refused"));
        when(brokenStore.getHash(anyString())).thenThrow(new StoreUnavailableException("connection refused"));
        AdaptiveRateLimiter degraded = newRateLimiter(brokenStore);

        // When
        RateLimitResult result = degraded.checkRateLimit(tierRequest("u1", "pro", "/api/workflows"));

        // Then
        assertThat(result.isAllowed()).isTrue();
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getPolicy()).isEqualTo("pro-tier");
        assertThat(meterRegistry.counter("ratelimit.degraded", "algorithm", "token-bucket").count())
                .isEqualTo(1.0);
    }

    @Test
    void adaptivePolicyShouldFailOpenWhenStoreAndAuditAreDown() {
        // Given
        CounterStore brokenStore = mock(CounterStore.class);
        when(brokenStore.execute(any(), anyList(), anyList()))
                .thenThrow(new StoreUnavailableException("connection refused"));
        when(brokenStore.getHash(anyString())).thenThrow(new StoreUnavailableException("connection refused"));
        doThrow(new StoreUnavailableException("connection refused"))
                .when(brokenStore).set(anyString(), anyString(), any());
        AdaptiveRateLimiter degraded = newRateLimiter(brokenStore);

        // When
        RateLimitResult result = degraded.checkRateLimit(tierRequest("u9", "enterprise", "/api/workflows"));

        // Then
        assertThat(result.isAllowed()).isTrue();
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getPolicy()).isEqualTo("enterprise-tier");
        assertThat(result.getRemaining()).isPositive();
        assertThat(meterRegistry.counter("ratelimit.degraded", "algorithm", "adaptive").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("ratelimit.adaptive.decisions", "result", "allowed").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("ratelimit.errors").count()).isZero();
    }

    @Test
    void nullRequestShouldReturnFallback() {
        // When
        RateLimitResult result = rateLimiter.checkRateLimit(null);

        // Then
        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getPolicy()).isEqualTo("fallback");
        assertThat(result.getLimit()).isEqualTo(1000);
        assertThat(result.getRemaining()).isEqualTo(999);
        assertThat(result.getResetTime()).isEqualTo(clock.instant().plusSeconds(3600));
    }

    @Test
    void resetLimitsShouldRestoreQuota() {
        // Given
        RateLimitRequest request = RateLimitRequest.builder().ip("198.51.100.2").path("/api/auth/login").userId("u4").build();
        for (int i = 0; i < 5; i++) {
            rateLimiter.checkRateLimit(request);
        }
        assertThat(rateLimiter.checkRateLimit(request).isAllowed()).isFalse();

        // When
        String key = rateLimiter.resetLimits(request);

        // Then
        assertThat(key).isEqualTo("auth-endpoints:user:u4:/api/auth/login");
        assertThat(rateLimiter.checkRateLimit(request).isAllowed()).isTrue();
    }

    @Test
    void removedPolicyShouldNoLongerMatch() {
        // When
        assertThat(rateLimiter.removePolicy("free-tier")).isTrue();
        RateLimitResult result = rateLimiter.checkRateLimit(tierRequest("u5", "free", "/home"));

        // Then
        assertThat(result.getPolicy()).isEqualTo("default");
        assertThat(rateLimiter.getPolicies()).hasSize(5);
    }

    @Test
    void policyWritesShouldDropCompiledPatterns() {
        // Given
        rateLimiter.addPolicy(RateLimitPolicy.builder()
                .name("exports").algorithm(RateLimitAlgorithm.FIXED_WINDOW).limit(5).window(60).priority(20)
                .condition(PolicyCondition.of("path", ConditionOperator.MATCHES, "^/api/exports/.+"))
                .build());
        RateLimitResult result = rateLimiter.checkRateLimit(tierRequest("u6", "free", "/api/exports/1"));
        assertThat(result.getPolicy()).isEqualTo("exports");
        assertThat(policyMatcher.cachedPatternCount()).isEqualTo(1);

        // When
        rateLimiter.removePolicy("exports");

        // Then
        assertThat(policyMatcher.cachedPatternCount()).isZero();
        assertThat(rateLimiter.checkRateLimit(tierRequest("u6", "free", "/api/exports/1")).getPolicy())
                .isEqualTo("free-tier");
    }

    @Test
    void slowPolicyShouldRefillOneTokenPerInterval() {
        // Given
        RateLimitPolicy policy = RateLimitPolicy.builder()
                .name("slow").algorithm(RateLimitAlgorithm.TOKEN_BUCKET).limit(50).window(60).build();

        // When
        TokenBucketLimiter.Config config = AdaptiveRateLimiter.tokenBucketConfig(policy);

        // Then
        assertThat(config.getRefillRate()).isEqualTo(1.0);
        assertThat(config.getRefillInterval()).isEqualTo(2);
        assertThat(config.getInitialTokens()).isEqualTo(50);
    }

    @Test
    void fastPolicyShouldRefillEverySecond() {
        // Given
        RateLimitPolicy policy = RateLimitPolicy.builder()
                .name("fast").algorithm(RateLimitAlgorithm.TOKEN_BUCKET).limit(120).window(60).burst(10).build();

        // When
        TokenBucketLimiter.Config config = AdaptiveRateLimiter.tokenBucketConfig(policy);

        // Then
        assertThat(config.getRefillRate()).isEqualTo(2.0);
        assertThat(config.getRefillInterval()).isEqualTo(1);
        assertThat(config.getCapacity()).isEqualTo(120);
        assertThat(config.getInitialTokens()).isEqualTo(10);
    }
}
