package com.adaptivelimiter.config;

import com.adaptivelimiter.model.RateLimitAlgorithm;
import com.adaptivelimiter.service.PolicyRegistry;
import com.adaptivelimiter.store.CounterStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Configuration
@RequiredArgsConstructor
public class HealthConfig {

    static final long LATENCY_DOWN_MS = 100;
    static final long LATENCY_WARN_MS = 50;

    private final CounterStore counterStore;
    private final PolicyRegistry policyRegistry;

    // ─── Counter store: connectivity + latency ───────────────────────
    @Bean
    public HealthIndicator counterStoreHealthIndicator() {
        return () -> {
            try {
                Duration latency = counterStore.ping();
                long latencyMs = latency.toMillis();

                if (latencyMs > LATENCY_DOWN_MS) {
                    return Health.down()
                            .withDetail("reason", "Store latency " + latencyMs + "ms > " + LATENCY_DOWN_MS + "ms threshold")
                            .withDetail("store", counterStore.getClass().getSimpleName())
                            .build();
                }

                Health.Builder b = Health.up()
                        .withDetail("latencyMs", latencyMs)
                        .withDetail("store", counterStore.getClass().getSimpleName());
                if (latencyMs > LATENCY_WARN_MS) {
                    b.withDetail("warning", "Store latency " + latencyMs + "ms approaching threshold");
                }
                return b.build();

            } catch (Exception e) {
                return Health.down(e).withDetail("error", "Cannot reach counter store").build();
            }
        };
    }

    // ─── Rate limiter: algorithms + loaded policies ──────────────────
    @Bean
    public HealthIndicator rateLimiterHealthIndicator() {
        return () -> {
            List<String> algorithms = Arrays.stream(RateLimitAlgorithm.values())
                    .map(RateLimitAlgorithm::getValue)
                    .toList();
            return Health.up()
                    .withDetail("algorithms", algorithms)
                    .withDetail("policies", policyRegistry.size())
                    .build();
        };
    }
}
