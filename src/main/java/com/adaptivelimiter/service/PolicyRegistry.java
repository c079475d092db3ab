package com.adaptivelimiter.service;

import com.adaptivelimiter.model.RateLimitPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory registry of named policies.
 * <p>
 * Reads on the request path go through an immutable snapshot sorted by priority (descending),
 * rebuilt on every write. The sort is stable, so policies with equal priority resolve in
 * registration order; re-registering a name keeps its original slot.
 */
@Slf4j
@Component
public class PolicyRegistry {

    private static final Comparator<RateLimitPolicy> BY_PRIORITY_DESC =
            Comparator.comparingInt(RateLimitPolicy::effectivePriority).reversed();

    // guarded by this; insertion order is the tie-break
    private final Map<String, RateLimitPolicy> policies = new LinkedHashMap<>();
    private volatile List<RateLimitPolicy> ordered = List.of();

    @Value("${ratelimiter.policies.load-defaults:true}")
    private boolean loadDefaults = true;

    @PostConstruct
    public void init() {
        if (loadDefaults) {
            DefaultPolicies.all().forEach(this::register);
            log.info("Registered {} default rate limit policies", size());
        }
    }

    public synchronized void register(RateLimitPolicy policy) {
        policy.validate();
        boolean replaced = policies.put(policy.getName(), policy.copy()) != null;
        rebuild();
        log.info("Rate limit policy {}: {} ({})", replaced ? "replaced" : "added",
                policy.getName(), policy.getDescription());
    }

    public synchronized boolean remove(String name) {
        boolean removed = policies.remove(name) != null;
        if (removed) {
            rebuild();
            log.info("Rate limit policy removed: {}", name);
        }
        return removed;
    }

    public synchronized Optional<RateLimitPolicy> get(String name) {
        return Optional.ofNullable(policies.get(name)).map(RateLimitPolicy::copy);
    }

    // resolution order: priority descending, then registration order
    public List<RateLimitPolicy> getOrderedPolicies() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }

    private void rebuild() {
        List<RateLimitPolicy> snapshot = new ArrayList<>(policies.values());
        snapshot.sort(BY_PRIORITY_DESC);
        ordered = List.copyOf(snapshot);
    }
}
