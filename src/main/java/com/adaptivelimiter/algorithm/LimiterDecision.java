package com.adaptivelimiter.algorithm;

import com.adaptivelimiter.dto.CheckStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// outcome of a single limiter step, before it is normalized for the caller
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LimiterDecision {
    private boolean allowed;
    // tokens or requests left after this check
    private long remaining;
    // seconds, only set on denial
    private Long retryAfterSeconds;
    private Instant resetTime;
    @Builder.Default
    private CheckStatus status = CheckStatus.OK;

    public static LimiterDecision allowed(long remaining, Instant resetTime) {
        return LimiterDecision.builder()
                .allowed(true)
                .remaining(remaining)
                .resetTime(resetTime)
                .build();
    }

    public static LimiterDecision denied(long remaining, Instant resetTime, long retryAfterSeconds) {
        return LimiterDecision.builder()
                .allowed(false)
                .remaining(remaining)
                .resetTime(resetTime)
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }

    // fail-open allow used when the store cannot answer
    public static LimiterDecision degraded(long remaining, Instant resetTime) {
        return LimiterDecision.builder()
                .allowed(true)
                .remaining(remaining)
                .resetTime(resetTime)
                .status(CheckStatus.DEGRADED)
                .build();
    }

    public boolean isDegraded() {
        return status == CheckStatus.DEGRADED;
    }
}
