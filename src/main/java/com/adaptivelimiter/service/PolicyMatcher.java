package com.adaptivelimiter.service;

import com.adaptivelimiter.dto.RateLimitRequest;
import com.adaptivelimiter.model.PolicyCondition;
import com.adaptivelimiter.model.PolicyOverride;
import com.adaptivelimiter.model.RateLimitPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates policy conditions against a request. Evaluation never throws: a condition that
 * cannot be evaluated (bad regex, type mismatch, unknown field) is simply false.
 */
@Slf4j
@Component
public class PolicyMatcher {

    private static final String HEADER_PREFIX = "header.";
    private static final String METADATA_PREFIX = "metadata.";

    // Cache compiled patterns; an invalid expression is cached as empty so it is only reported once
    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    // all conditions must hold; a policy without conditions matches everything
    public boolean matchesAll(List<PolicyCondition> conditions, RateLimitRequest request) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        for (PolicyCondition condition : conditions) {
            if (!matches(condition, request)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(PolicyCondition condition, RateLimitRequest request) {
        if (condition == null || condition.getField() == null || condition.getOperator() == null) {
            return false;
        }
        return evaluate(resolveField(request, condition.getField()), condition);
    }

    // first override whose condition matches
    public Optional<PolicyOverride> findOverride(RateLimitPolicy policy, RateLimitRequest request) {
        if (policy.getOverrides() == null) {
            return Optional.empty();
        }
        return policy.getOverrides().stream()
                .filter(override -> override != null && matches(override.getCondition(), request))
                .findFirst();
    }

    public Object resolveField(RateLimitRequest request, String field) {
        switch (field) {
            case "userId":
                return request.getUserId();
            case "apiKey":
                return request.getApiKey();
            case "ip":
                return request.getIp();
            case "path":
                return request.getPath();
            case "method":
                return request.getMethod();
            case "userAgent":
                return request.getUserAgent();
            case "origin":
                return request.getOrigin();
            case "userTier":
                return metadata(request, "userTier");
            default:
                if (field.startsWith(HEADER_PREFIX)) {
                    Map<String, String> headers = request.getHeaders();
                    return headers != null ? headers.get(field.substring(HEADER_PREFIX.length())) : null;
                }
                if (field.startsWith(METADATA_PREFIX)) {
                    return metadata(request, field.substring(METADATA_PREFIX.length()));
                }
                return metadata(request, field);
        }
    }

    boolean evaluate(Object value, PolicyCondition condition) {
        Object expected = condition.getValue();
        return switch (condition.getOperator()) {
            case EQUALS -> valuesEqual(value, expected);
            case CONTAINS -> value instanceof String && expected != null
                    && ((String) value).contains(expected.toString());
            case MATCHES -> value instanceof String && expected instanceof String
                    && compile((String) expected).map(p -> p.matcher((String) value).find()).orElse(false);
            case IN -> expected instanceof Collection
                    && ((Collection<?>) expected).stream().anyMatch(candidate -> valuesEqual(value, candidate));
            case GREATER -> value instanceof Number && expected instanceof Number
                    && Double.compare(((Number) value).doubleValue(), ((Number) expected).doubleValue()) > 0;
            case LESS -> value instanceof Number && expected instanceof Number
                    && Double.compare(((Number) value).doubleValue(), ((Number) expected).doubleValue()) < 0;
        };
    }

    // called on every policy write so patterns of removed or replaced policies are not kept
    public void clearCache() {
        patternCache.clear();
    }

    int cachedPatternCount() {
        return patternCache.size();
    }

    private Optional<Pattern> compile(String regex) {
        return patternCache.computeIfAbsent(regex, r -> {
            try {
                return Optional.of(Pattern.compile(r));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid regex in policy condition, treating as no match: {}", r, e);
                return Optional.empty();
            }
        });
    }

    private static Object metadata(RateLimitRequest request, String key) {
        Map<String, Object> metadata = request.getMetadata();
        return metadata != null ? metadata.get(key) : null;
    }

    // JSON numbers arrive as Integer, Long or Double; compare them by value
    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }
}
