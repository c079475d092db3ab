package com.adaptivelimiter.filter;

import com.adaptivelimiter.dto.RateLimitResult;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging context for every HTTP request.
 * <p>
 * The request id ({@code X-Request-Id}, generated when absent) is echoed on the response and kept
 * in the {@code requestId} MDC key. Once a rate limit check has been decided,
 * {@link #tag(HttpServletRequest, RateLimitResult)} adds the resolved policy under the
 * {@code policy} key, and the filter writes one summary line for the check when the request completes.
 */
@Slf4j
@Component
public class RateLimitContextFilter extends OncePerRequestFilter {

    static final String HEADER = "X-Request-Id";
    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_POLICY = "policy";
    static final String RESULT_ATTRIBUTE = RateLimitContextFilter.class.getName() + ".result";

    // called by the check endpoint once the engine has answered
    public static void tag(HttpServletRequest request, RateLimitResult result) {
        request.setAttribute(RESULT_ATTRIBUTE, result);
        MDC.put(MDC_POLICY, result.getPolicy());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req,
            HttpServletResponse res,
            FilterChain chain)
            throws IOException, ServletException {

        String id = req.getHeader(HEADER);
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }

        MDC.put(MDC_REQUEST_ID, id);
        res.setHeader(HEADER, id);
        long startTime = System.nanoTime();

        try {
            chain.doFilter(req, res);
            logCheck(req, res, startTime);
        } finally {
            MDC.remove(MDC_POLICY);
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private static void logCheck(HttpServletRequest req, HttpServletResponse res, long startTime) {
        Object attribute = req.getAttribute(RESULT_ATTRIBUTE);
        if (!(attribute instanceof RateLimitResult)) {
            return;
        }
        RateLimitResult result = (RateLimitResult) attribute;
        long latencyMicros = (System.nanoTime() - startTime) / 1000;
        if (result.isDegraded()) {
            log.warn("Check completed degraded: status={}, policy={}, latency={}μs",
                    res.getStatus(), result.getPolicy(), latencyMicros);
        } else if (!result.isAllowed()) {
            log.info("Check denied: status={}, policy={}, retryAfter={}s, latency={}μs",
                    res.getStatus(), result.getPolicy(), result.getRetryAfter(), latencyMicros);
        } else {
            log.debug("Check allowed: status={}, policy={}, remaining={}, latency={}μs",
                    res.getStatus(), result.getPolicy(), result.getRemaining(), latencyMicros);
        }
    }
}
