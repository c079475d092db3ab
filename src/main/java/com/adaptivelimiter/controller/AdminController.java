package com.adaptivelimiter.controller;

import com.adaptivelimiter.dto.RateLimitRequest;
import com.adaptivelimiter.model.RateLimitPolicy;
import com.adaptivelimiter.model.SystemLoad;
import com.adaptivelimiter.model.UserBehavior;
import com.adaptivelimiter.service.AdaptiveRateLimiter;
import com.adaptivelimiter.store.StoreUnavailableException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Policy and signal management")
public class AdminController {

    private final AdaptiveRateLimiter rateLimiter;

    // ─── Policies ─────────────────────────────────────────────────────

    @GetMapping("/policies")
    @Operation(summary = "List policies", description = "All registered policies in evaluation order")
    public ResponseEntity<List<RateLimitPolicy>> getPolicies() {
        return ResponseEntity.ok(rateLimiter.getPolicies());
    }

    @GetMapping("/policies/{name}")
    @Operation(summary = "Get policy", description = "Look up a single policy by name")
    public ResponseEntity<RateLimitPolicy> getPolicy(@PathVariable String name) {
        return rateLimiter.getPolicy(name)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/policies")
    @Operation(summary = "Add policy", description = "Register a policy, replacing any policy with the same name")
    public ResponseEntity<RateLimitPolicy> addPolicy(@RequestBody RateLimitPolicy policy) {
        rateLimiter.addPolicy(policy);
        return ResponseEntity.status(HttpStatus.CREATED).body(policy);
    }

    @DeleteMapping("/policies/{name}")
    @Operation(summary = "Remove policy", description = "Unregister a policy by name")
    public ResponseEntity<Void> removePolicy(@PathVariable String name) {
        if (!rateLimiter.removePolicy(name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    // ─── Signals ──────────────────────────────────────────────────────

    @PutMapping("/system-load")
    @Operation(summary = "Update system load", description = "Record current cpu, memory, latency and error rate")
    public ResponseEntity<Void> updateSystemLoad(@RequestBody SystemLoad load) {
        rateLimiter.updateSystemLoad(load);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/behavior/{identity}")
    @Operation(summary = "Update user behavior", description = "Record behavior metrics for a user id or ip")
    public ResponseEntity<Void> updateUserBehavior(@PathVariable String identity,
            @RequestBody UserBehavior behavior) {
        rateLimiter.updateUserBehavior(identity, behavior);
        return ResponseEntity.noContent().build();
    }

    // ─── Counters ─────────────────────────────────────────────────────

    @PostMapping("/limits/reset")
    @Operation(summary = "Reset limits", description = "Clear counters for the key the request resolves to")
    public ResponseEntity<Void> resetLimits(@Valid @RequestBody RateLimitRequest request) {
        rateLimiter.resetLimits(request);
        return ResponseEntity.noContent().build();
    }

    // ─── Errors ───────────────────────────────────────────────────────

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleInvalidArgument(IllegalArgumentException e) {
        log.warn("Rejected admin request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Counter store unavailable during admin request", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Counter store unavailable"));
    }
}
