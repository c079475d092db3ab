package com.adaptivelimiter.service;

import com.adaptivelimiter.algorithm.FixedWindowLimiter;
import com.adaptivelimiter.algorithm.LimiterDecision;
import com.adaptivelimiter.algorithm.SlidingWindowLimiter;
import com.adaptivelimiter.algorithm.TokenBucketLimiter;
import com.adaptivelimiter.dto.RateLimitRequest;
import com.adaptivelimiter.dto.RateLimitResult;
import com.adaptivelimiter.model.AdaptiveDecision;
import com.adaptivelimiter.model.PolicyOverride;
import com.adaptivelimiter.model.RateLimitAlgorithm;
import com.adaptivelimiter.model.RateLimitPolicy;
import com.adaptivelimiter.model.SystemLoad;
import com.adaptivelimiter.model.UserBehavior;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the engine: resolves the policy for a request, derives the limiting key,
 * runs the policy's algorithm and normalizes the outcome into a {@link RateLimitResult}.
 * <p>
 * {@link #checkRateLimit} never throws. Any failure yields a generous fail-open result tagged
 * {@link com.adaptivelimiter.dto.CheckStatus#DEGRADED}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptiveRateLimiter {

    private final PolicyRegistry policyRegistry;
    private final PolicyMatcher policyMatcher;
    private final TokenBucketLimiter tokenBucketLimiter;
    private final SlidingWindowLimiter slidingWindowLimiter;
    private final FixedWindowLimiter fixedWindowLimiter;
    private final AdaptiveLimitCalculator adaptiveLimitCalculator;
    private final LoadSignalService loadSignalService;
    private final AdaptiveDecisionRecorder decisionRecorder;
    private final MetricsService metricsService;
    private final Clock clock;

    // implicit policy when nothing in the registry matches
    @Value("${ratelimiter.default.algorithm:sliding-window}")
    private String defaultAlgorithm = "sliding-window";

    @Value("${ratelimiter.default.limit:100}")
    private int defaultLimit = 100;

    @Value("${ratelimiter.default.window-seconds:3600}")
    private int defaultWindow = 3600;

    public RateLimitResult checkRateLimit(RateLimitRequest request) {
        long startTime = System.nanoTime();

        try {
            RateLimitPolicy policy = resolvePolicy(request);
            String key = generateKey(request, policy);
            String algorithm = policy.getAlgorithm().getValue();

            LimiterDecision decision = switch (policy.getAlgorithm()) {
                case TOKEN_BUCKET -> tokenBucketLimiter.check(key, tokenBucketConfig(policy));
                case SLIDING_WINDOW -> slidingWindowLimiter.check(key, slidingWindowConfig(policy.getLimit(), policy.getWindow()));
                case FIXED_WINDOW -> fixedWindowLimiter.check(key, FixedWindowLimiter.Config.builder()
                        .limit(policy.getLimit())
                        .window(policy.getWindow())
                        .build());
                case ADAPTIVE -> adaptiveCheck(key, policy, request);
            };

            RateLimitResult result = normalize(policy, decision);

            long latencyMicros = (System.nanoTime() - startTime) / 1000;
            metricsService.recordCheck(policy.getName(), algorithm, decision.isAllowed(), latencyMicros);

            if (decision.isDegraded()) {
                metricsService.recordDegraded(algorithm);
                log.warn("Degraded: {} check for policy={} key={} failed open", algorithm, policy.getName(), key);
            } else if (!decision.isAllowed()) {
                log.warn("Rate limit exceeded: policy={}, key={}, userId={}, ip={}, path={}, retryAfter={}s",
                        policy.getName(), key, request.getUserId(), request.getIp(), request.getPath(),
                        result.getRetryAfter());
            }

            return result;

        } catch (Exception e) {
            log.error("Degraded: rate limit check failed for ip={}, path={}, failing open",
                    request != null ? request.getIp() : null,
                    request != null ? request.getPath() : null, e);
            metricsService.recordError();
            return RateLimitResult.fallback(clock.instant());
        }
    }

    // ─── Admin operations ─────────────────────────────────────────────

    public void addPolicy(RateLimitPolicy policy) {
        policyRegistry.register(policy);
        policyMatcher.clearCache();
    }

    public boolean removePolicy(String name) {
        boolean removed = policyRegistry.remove(name);
        if (removed) {
            policyMatcher.clearCache();
        }
        return removed;
    }

    public List<RateLimitPolicy> getPolicies() {
        return policyRegistry.getOrderedPolicies().stream()
                .map(RateLimitPolicy::copy)
                .toList();
    }

    public Optional<RateLimitPolicy> getPolicy(String name) {
        return policyRegistry.get(name);
    }

    public void updateSystemLoad(SystemLoad load) {
        loadSignalService.updateSystemLoad(load);
    }

    public void updateUserBehavior(String identity, UserBehavior behavior) {
        loadSignalService.updateUserBehavior(identity, behavior);
    }

    // clears every algorithm's state for the key the request currently resolves to
    public String resetLimits(RateLimitRequest request) {
        RateLimitPolicy policy = resolvePolicy(request);
        String key = generateKey(request, policy);
        tokenBucketLimiter.reset(key);
        slidingWindowLimiter.reset(key);
        fixedWindowLimiter.reset(key);
        log.info("Reset rate limits for key: {}", key);
        return key;
    }

    // ─── Pipeline steps ───────────────────────────────────────────────

    RateLimitPolicy resolvePolicy(RateLimitRequest request) {
        for (RateLimitPolicy policy : policyRegistry.getOrderedPolicies()) {
            if (policyMatcher.matchesAll(policy.getConditions(), request)) {
                return policyMatcher.findOverride(policy, request)
                        .map(override -> applyOverride(policy, override))
                        .orElse(policy);
            }
        }
        return defaultPolicy();
    }

    String generateKey(RateLimitRequest request, RateLimitPolicy policy) {
        StringBuilder key = new StringBuilder(policy.getName())
                .append(':')
                .append(request.identity());
        // endpoint policies are counted per path
        if (policy.getName().contains("endpoint")) {
            key.append(':').append(request.getPath());
        }
        return key.toString();
    }

    /**
     * Token bucket parameters for a policy: capacity = limit, one refill per second of
     * {@code floor(limit / window)} tokens, starting at the burst allowance. When the limit is
     * below one request per second the bucket instead refills one token every
     * {@code ceil(window / limit)} seconds, which keeps the average rate.
     */
    static TokenBucketLimiter.Config tokenBucketConfig(RateLimitPolicy policy) {
        int limit = policy.getLimit();
        int window = policy.getWindow();
        int refillRate = limit / window;
        int refillInterval = 1;
        if (refillRate == 0) {
            refillRate = 1;
            refillInterval = (window + limit - 1) / limit;
        }
        return TokenBucketLimiter.Config.builder()
                .capacity(limit)
                .refillRate(refillRate)
                .refillInterval(refillInterval)
                .initialTokens(policy.getBurst() != null ? policy.getBurst() : limit)
                .build();
    }

    private static SlidingWindowLimiter.Config slidingWindowConfig(int limit, int window) {
        return SlidingWindowLimiter.Config.builder()
                .limit(limit)
                .windowSize(window)
                .precision(1)
                .build();
    }

    private LimiterDecision adaptiveCheck(String key, RateLimitPolicy policy, RateLimitRequest request) {
        String identity = request.getUserId() != null ? request.getUserId() : request.getIp();
        UserBehavior behavior = loadSignalService.getUserBehavior(identity);
        SystemLoad load = loadSignalService.getSystemLoad();

        double multiplier = adaptiveLimitCalculator.multiplier(behavior, load);
        int adjustedLimit = adaptiveLimitCalculator.adjustedLimit(policy.getLimit(), multiplier);

        LimiterDecision decision = slidingWindowLimiter.check(key, slidingWindowConfig(adjustedLimit, policy.getWindow()));

        decisionRecorder.record(AdaptiveDecision.builder()
                .policy(policy.getName())
                .userId(request.getUserId())
                .ip(request.getIp())
                .originalLimit(policy.getLimit())
                .adjustedLimit(adjustedLimit)
                .multiplier(multiplier)
                .userBehavior(behavior)
                .systemLoad(load)
                .allowed(decision.isAllowed())
                .timestamp(clock.instant())
                .build());

        return decision;
    }

    private RateLimitResult normalize(RateLimitPolicy policy, LimiterDecision decision) {
        Long retryAfter = decision.isAllowed() ? null : decision.getRetryAfterSeconds();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(RateLimitResult.HEADER_POLICY, policy.getName());
        headers.put(RateLimitResult.HEADER_LIMIT, String.valueOf(policy.getLimit()));
        headers.put(RateLimitResult.HEADER_REMAINING, String.valueOf(decision.getRemaining()));
        headers.put(RateLimitResult.HEADER_RESET, String.valueOf(decision.getResetTime().getEpochSecond()));
        headers.put(RateLimitResult.HEADER_ALGORITHM, policy.getAlgorithm().getValue());
        if (retryAfter != null && retryAfter > 0) {
            headers.put(RateLimitResult.HEADER_RETRY_AFTER, String.valueOf(retryAfter));
        }

        return RateLimitResult.builder()
                .allowed(decision.isAllowed())
                .policy(policy.getName())
                .limit(policy.getLimit())
                .remaining(decision.getRemaining())
                .resetTime(decision.getResetTime())
                .retryAfter(retryAfter)
                .headers(headers)
                .status(decision.getStatus())
                .build();
    }

    private static RateLimitPolicy applyOverride(RateLimitPolicy policy, PolicyOverride override) {
        RateLimitPolicy.RateLimitPolicyBuilder builder = policy.toBuilder();
        if (override.getLimit() != null) {
            builder.limit(override.getLimit());
        }
        if (override.getWindow() != null) {
            builder.window(override.getWindow());
        }
        if (override.getAlgorithm() != null) {
            builder.algorithm(RateLimitAlgorithm.fromValue(override.getAlgorithm()));
        }
        return builder.build();
    }

    private RateLimitPolicy defaultPolicy() {
        return RateLimitPolicy.builder()
                .name("default")
                .algorithm(RateLimitAlgorithm.fromValue(defaultAlgorithm))
                .limit(defaultLimit)
                .window(defaultWindow)
                .build();
    }
}
