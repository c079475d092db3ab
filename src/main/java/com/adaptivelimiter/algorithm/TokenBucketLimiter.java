package com.adaptivelimiter.algorithm;

import com.adaptivelimiter.store.CounterScript;
import com.adaptivelimiter.store.CounterStore;
import com.adaptivelimiter.store.StoreUnavailableException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// token bucket rate limiting: fixed capacity, refilled by whole intervals, one atomic store step per check
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenBucketLimiter {

    static final String KEY_PREFIX = "tb:";

    private final CounterStore counterStore;
    private final Clock clock;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Config {
        private int capacity;
        // tokens added per elapsed interval
        private double refillRate;
        // seconds
        private int refillInterval;
        // starting tokens for a new bucket, capacity when unset
        private Integer initialTokens;

        public void validate() {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Capacity must be positive");
            }
            if (refillRate <= 0) {
                throw new IllegalArgumentException("Refill rate must be positive");
            }
            if (refillInterval <= 0) {
                throw new IllegalArgumentException("Refill interval must be positive");
            }
            if (initialTokens != null && initialTokens < 0) {
                throw new IllegalArgumentException("Initial tokens must not be negative");
            }
        }
    }

    @Data
    @AllArgsConstructor
    public static class BucketState {
        private double tokens;
        private Instant lastRefill;
    }

    public LimiterDecision check(String key, Config config) {
        return check(key, config, 1);
    }

    /**
     * Take {@code requestTokens} from the bucket for {@code key}.
     * Fails open with a {@link com.adaptivelimiter.dto.CheckStatus#DEGRADED} decision when the store is unavailable.
     */
    public LimiterDecision check(String key, Config config, int requestTokens) {
        config.validate();
        if (requestTokens <= 0) {
            throw new IllegalArgumentException("Requested tokens must be positive");
        }

        long startTime = System.nanoTime();
        long nowMillis = clock.millis();
        String bucketKey = KEY_PREFIX + key;
        int initialTokens = config.getInitialTokens() != null ? config.getInitialTokens() : config.getCapacity();

        try {
            List<Long> result = counterStore.execute(
                CounterScript.TOKEN_BUCKET,
                List.of(bucketKey),
                List.of(
                    String.valueOf(config.getCapacity()),
                    String.valueOf(config.getRefillRate()),
                    String.valueOf(config.getRefillInterval()),
                    String.valueOf(requestTokens),
                    String.valueOf(nowMillis),
                    String.valueOf(initialTokens)
                )
            );

            if (result.size() < 3) {
                throw new StoreUnavailableException("Invalid response from token bucket script");
            }

            boolean allowed = result.get(0) == 1L;
            long tokensRemaining = result.get(1);
            long retryAfter = result.get(2);
            Instant resetTime = Instant.ofEpochMilli(nowMillis).plusSeconds(retryAfter);

            long latencyMicros = (System.nanoTime() - startTime) / 1000;
            log.debug("Token Bucket check for key={}: allowed={}, remaining={}, latency={}μs",
                    key, allowed, tokensRemaining, latencyMicros);

            if (allowed) {
                return LimiterDecision.allowed(tokensRemaining, resetTime);
            }
            log.warn("Token bucket rate limit exceeded for key={}: requested={}, remaining={}, retryAfter={}s",
                    key, requestTokens, tokensRemaining, retryAfter);
            return LimiterDecision.denied(tokensRemaining, resetTime, retryAfter);

        } catch (Exception e) {
            log.error("Degraded: token bucket check failed for key={}, failing open", key, e);
            return LimiterDecision.degraded(config.getCapacity(), Instant.ofEpochMilli(nowMillis));
        }
    }

    public Optional<BucketState> getState(String key) {
        Map<String, String> hash = counterStore.getHash(KEY_PREFIX + key);
        String tokens = hash.get("tokens");
        String lastRefill = hash.get("lastRefill");
        if (tokens == null || lastRefill == null) {
            return Optional.empty();
        }
        return Optional.of(new BucketState(
                Double.parseDouble(tokens),
                Instant.ofEpochMilli((long) Double.parseDouble(lastRefill))));
    }

    // deletes the bucket so the next check starts from initial tokens
    public void reset(String key) {
        counterStore.delete(KEY_PREFIX + key);
        log.info("Reset Token Bucket for key: {}", key);
    }
}
