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

/**
 * Sliding window counter. The window is split into {@code precision} sub-buckets and only the
 * current and the previous one are kept per key; the previous count is weighted by the fraction
 * of it still inside the window:
 * <pre>
 *   weighted = previous * (1 - elapsedInCurrent / subBucket) + current
 * </pre>
 * Memory is constant per key. Compared to an exact request log it can over-admit by at most
 * one sub-bucket's worth of requests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlidingWindowLimiter {

    static final String KEY_PREFIX = "sw:";

    private final CounterStore counterStore;
    private final Clock clock;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Config {
        private int limit;
        // seconds
        private int windowSize;
        @Builder.Default
        private int precision = 1;

        public void validate() {
            // zero is legal: an adaptive limit can scale down to nothing
            if (limit < 0) {
                throw new IllegalArgumentException("Limit must not be negative");
            }
            if (windowSize <= 0) {
                throw new IllegalArgumentException("Window size must be positive");
            }
            if (precision <= 0 || precision > windowSize * 1000L) {
                throw new IllegalArgumentException("Precision must be between 1 and the window size in milliseconds");
            }
        }

        public long subBucketMillis() {
            return windowSize * 1000L / precision;
        }
    }

    @Data
    @AllArgsConstructor
    public static class WindowState {
        private long currentCount;
        private long previousCount;
        // previous count scaled by its remaining overlap, plus the current count
        private double weightedCount;
        private Instant currentBucketStart;
    }

    public LimiterDecision check(String key, Config config) {
        config.validate();

        long startTime = System.nanoTime();
        long nowMillis = clock.millis();
        long subBucketMillis = config.subBucketMillis();
        long currentStart = Math.floorDiv(nowMillis, subBucketMillis) * subBucketMillis;
        long previousStart = currentStart - subBucketMillis;
        Instant resetTime = Instant.ofEpochMilli(currentStart + subBucketMillis);

        try {
            // both keys share a hash tag so the script stays on one cluster slot
            List<Long> result = counterStore.execute(
                CounterScript.SLIDING_WINDOW,
                List.of(bucketKey(key, currentStart), bucketKey(key, previousStart)),
                List.of(
                    String.valueOf(config.getLimit()),
                    String.valueOf(subBucketMillis),
                    String.valueOf(nowMillis),
                    String.valueOf(currentStart)
                )
            );

            if (result.size() < 3) {
                throw new StoreUnavailableException("Invalid response from sliding window script");
            }

            boolean allowed = result.get(0) == 1L;
            long weightedCount = result.get(1);
            long currentCount = result.get(2);
            long remaining = Math.max(0, config.getLimit() - weightedCount - (allowed ? 1 : 0));

            long latencyMicros = (System.nanoTime() - startTime) / 1000;
            log.debug("Sliding Window check for key={}: allowed={}, weighted_count={}, current_count={}, latency={}μs",
                    key, allowed, weightedCount, currentCount, latencyMicros);

            if (allowed) {
                return LimiterDecision.allowed(remaining, resetTime);
            }
            long retryAfter = secondsUntil(resetTime, nowMillis);
            log.warn("Sliding window rate limit exceeded for key={}: weighted_count={}, limit={}, retryAfter={}s",
                    key, weightedCount, config.getLimit(), retryAfter);
            return LimiterDecision.denied(remaining, resetTime, retryAfter);

        } catch (Exception e) {
            log.error("Degraded: sliding window check failed for key={}, failing open", key, e);
            return LimiterDecision.degraded(config.getLimit(), resetTime);
        }
    }

    /**
     * Read the two sub-buckets that make up the window for {@code key} right now, without
     * counting a request. Only aggregate counts are kept, so there is no per-request history to report.
     */
    public WindowState getState(String key, Config config) {
        config.validate();
        long nowMillis = clock.millis();
        long subBucketMillis = config.subBucketMillis();
        long currentStart = Math.floorDiv(nowMillis, subBucketMillis) * subBucketMillis;
        long previousStart = currentStart - subBucketMillis;

        long currentCount = count(bucketKey(key, currentStart));
        long previousCount = count(bucketKey(key, previousStart));
        double overlap = (double) (nowMillis - currentStart) / subBucketMillis;
        double weightedCount = previousCount * (1 - overlap) + currentCount;

        return new WindowState(currentCount, previousCount, weightedCount, Instant.ofEpochMilli(currentStart));
    }

    // removes every sub-bucket for the key
    public void reset(String key) {
        long deleted = counterStore.deleteByPrefix(KEY_PREFIX + "{" + key + "}:");
        log.info("Reset Sliding Window for key: {} ({} sub-buckets)", key, deleted);
    }

    private long count(String bucketKey) {
        return counterStore.get(bucketKey).map(Long::parseLong).orElse(0L);
    }

    static String bucketKey(String key, long bucketStart) {
        return KEY_PREFIX + "{" + key + "}:" + bucketStart;
    }

    static long secondsUntil(Instant resetTime, long nowMillis) {
        return Math.max(1, (long) Math.ceil((resetTime.toEpochMilli() - nowMillis) / 1000.0));
    }
}
