package com.adaptivelimiter.controller;

import com.adaptivelimiter.dto.RateLimitRequest;
import com.adaptivelimiter.dto.RateLimitResult;
import com.adaptivelimiter.filter.RateLimitContextFilter;
import com.adaptivelimiter.service.AdaptiveRateLimiter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/ratelimit")
@RequiredArgsConstructor
@Tag(name = "Rate Limiter", description = "Rate limiting operations")
public class RateLimitController {

    private final AdaptiveRateLimiter rateLimiter;

    @PostMapping("/check")
    @Operation(summary = "Check rate limit",
            description = "Resolve the policy for the request attributes and consume one unit of its quota")
    public ResponseEntity<RateLimitResult> checkRateLimit(
            @Valid @RequestBody RateLimitRequest request,
            HttpServletRequest servletRequest) {

        log.debug("Rate limit check request: {}", request);
        RateLimitResult result = rateLimiter.checkRateLimit(request);
        RateLimitContextFilter.tag(servletRequest, result);

        HttpHeaders headers = new HttpHeaders();
        result.getHeaders().forEach(headers::set);

        HttpStatus status = result.isAllowed() ? HttpStatus.OK : HttpStatus.TOO_MANY_REQUESTS;
        return ResponseEntity.status(status)
                .headers(headers)
                .body(result);
    }
}
