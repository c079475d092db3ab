package com.adaptivelimiter.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitRequest {
    private String userId;
    private String apiKey;

    // fallback identity, always present
    @NotBlank(message = "IP cannot be blank")
    private String ip;

    private String path;
    private String method;
    private String userAgent;
    private String origin;

    // header names are matched case-sensitively
    @Singular
    private Map<String, String> headers;

    // free-form bag, e.g. userTier
    private Map<String, Object> metadata;

    /**
     * Identity the limit is scoped to: user, then API key, then IP.
     */
    public String identity() {
        if (userId != null && !userId.isEmpty()) {
            return "user:" + userId;
        }
        if (apiKey != null && !apiKey.isEmpty()) {
            return "key:" + apiKey;
        }
        return "ip:" + ip;
    }
}
