package com.adaptivelimiter.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry registry;

    // ─── Core check: tagged by policy, algorithm and result ──────────
    public void recordCheck(String policy, String algorithm, boolean allowed, long latencyMicros) {
        registry.counter("ratelimit.checks.total",
                "policy", policy,
                "algorithm", algorithm,
                "result", allowed ? "allowed" : "denied")
                .increment();

        registry.timer("ratelimit.check.duration",
                "algorithm", algorithm)
                .record(latencyMicros, TimeUnit.MICROSECONDS);
    }

    // ─── Fail-open allows, kept apart from normal allows ─────────────
    public void recordDegraded(String algorithm) {
        registry.counter("ratelimit.degraded",
                "algorithm", algorithm)
                .increment();
    }

    // ─── Adaptive decisions ───────────────────────────────────────────
    public void recordAdaptiveDecision(double multiplier, boolean allowed) {
        registry.counter("ratelimit.adaptive.decisions",
                "result", allowed ? "allowed" : "denied")
                .increment();

        registry.summary("ratelimit.adaptive.multiplier")
                .record(multiplier);
    }

    // ─── Pipeline errors ──────────────────────────────────────────────
    public void recordError() {
        registry.counter("ratelimit.errors").increment();
    }
}
