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
 * Fixed window counter over windows aligned to the epoch.
 * <p>
 * A client can get up to {@code 2 × limit} requests through in quick succession around a window
 * boundary (end of one window, start of the next). Use {@link SlidingWindowLimiter} where that matters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FixedWindowLimiter {

    static final String KEY_PREFIX = "fw:";

    private final CounterStore counterStore;
    private final Clock clock;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Config {
        private int limit;
        // seconds
        private int window;

        public void validate() {
            if (limit <= 0) {
                throw new IllegalArgumentException("Limit must be positive");
            }
            if (window <= 0) {
                throw new IllegalArgumentException("Window must be positive");
            }
        }
    }

    public LimiterDecision check(String key, Config config) {
        config.validate();

        long startTime = System.nanoTime();
        long nowMillis = clock.millis();
        long windowMillis = config.getWindow() * 1000L;
        long windowStart = Math.floorDiv(nowMillis, windowMillis) * windowMillis;
        Instant resetTime = Instant.ofEpochMilli(windowStart + windowMillis);
        String counterKey = KEY_PREFIX + key + ":" + windowStart;

        try {
            List<Long> result = counterStore.execute(
                CounterScript.FIXED_WINDOW,
                List.of(counterKey),
                List.of(
                    String.valueOf(config.getLimit()),
                    String.valueOf(windowMillis)
                )
            );

            if (result.size() < 2) {
                throw new StoreUnavailableException("Invalid response from fixed window script");
            }

            boolean allowed = result.get(0) == 1L;
            long current = result.get(1);
            long remaining = Math.max(0, config.getLimit() - current);

            long latencyMicros = (System.nanoTime() - startTime) / 1000;
            log.debug("Fixed Window check for key={}, window={}: allowed={}, remaining={}, latency={}μs",
                    key, windowStart, allowed, remaining, latencyMicros);

            if (allowed) {
                return LimiterDecision.allowed(remaining, resetTime);
            }
            long retryAfter = SlidingWindowLimiter.secondsUntil(resetTime, nowMillis);
            log.warn("Fixed window rate limit exceeded for key={}: count={}, limit={}, retryAfter={}s",
                    key, current, config.getLimit(), retryAfter);
            return LimiterDecision.denied(remaining, resetTime, retryAfter);

        } catch (Exception e) {
            log.error("Degraded: fixed window check failed for key={}, failing open", key, e);
            return LimiterDecision.degraded(config.getLimit(), resetTime);
        }
    }

    public void reset(String key) {
        long deleted = counterStore.deleteByPrefix(KEY_PREFIX + key + ":");
        log.info("Reset Fixed Window for key: {} ({} windows)", key, deleted);
    }
}
