package com.adaptivelimiter.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RateLimitResult {
    public static final String HEADER_POLICY = "X-RateLimit-Policy";
    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_ALGORITHM = "X-RateLimit-Algorithm";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    private boolean allowed;
    private String policy;
    private long limit;
    private long remaining;
    private Instant resetTime;
    // seconds, only when denied
    private Long retryAfter;
    private Map<String, String> headers;

    @JsonIgnore
    @Builder.Default
    private CheckStatus status = CheckStatus.OK;

    @JsonIgnore
    public boolean isDegraded() {
        return status == CheckStatus.DEGRADED;
    }

    public static RateLimitResult fallback(Instant now) {
        return RateLimitResult.builder()
                .allowed(true)
                .policy("fallback")
                .limit(1000)
                .remaining(999)
                .resetTime(now.plusSeconds(3600))
                .headers(Map.of())
                .status(CheckStatus.DEGRADED)
                .build();
    }
}
