package com.adaptivelimiter.store;

/**
 * Atomic read-compute-write steps the limiters need from the store.
 * Each maps to a Lua script for Redis and to an equivalent in-process routine.
 */
public enum CounterScript {
    /**
     * KEYS: bucket. ARGV: capacity, refillRate, refillIntervalSeconds, requestTokens, nowMillis, initialTokens.
     * Returns: allowed (0/1), tokens remaining (floored), retryAfter seconds.
     */
    TOKEN_BUCKET("lua/token_bucket.lua"),
    /**
     * KEYS: current sub-bucket, previous sub-bucket. ARGV: limit, subBucketMillis, nowMillis, currentBucketStartMillis.
     * Returns: allowed (0/1), ceil(weighted count) before this request, current sub-bucket count.
     */
    SLIDING_WINDOW("lua/sliding_window.lua"),
    /**
     * KEYS: window counter. ARGV: limit, windowMillis.
     * Returns: allowed (0/1), count after this request.
     */
    FIXED_WINDOW("lua/fixed_window.lua");

    private final String resourcePath;

    CounterScript(String resourcePath) {
        this.resourcePath = resourcePath;
    }

    public String getResourcePath() {
        return resourcePath;
    }
}
