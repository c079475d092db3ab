package com.adaptivelimiter.service;

import com.adaptivelimiter.model.AdaptiveDecision;
import com.adaptivelimiter.store.CounterStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;

// audit trail for adaptive decisions; never fails the check it records
@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptiveDecisionRecorder {

    static final String PREFIX = "adaptive:log:";
    static final Duration TTL = Duration.ofHours(1);

    private final CounterStore counterStore;
    private final ObjectMapper mapper;
    private final MetricsService metricsService;

    public void record(AdaptiveDecision decision) {
        log.info("Adaptive rate limit decision: policy={}, userId={}, ip={}, originalLimit={}, adjustedLimit={}, multiplier={}, allowed={}",
                decision.getPolicy(), decision.getUserId(), decision.getIp(), decision.getOriginalLimit(),
                decision.getAdjustedLimit(), String.format("%.3f", decision.getMultiplier()), decision.isAllowed());
        metricsService.recordAdaptiveDecision(decision.getMultiplier(), decision.isAllowed());
        try {
            String key = auditKey(decision);
            counterStore.set(key, mapper.writeValueAsString(decision), TTL);
        } catch (Exception e) {
            log.error("Failed to store adaptive decision for policy={}", decision.getPolicy(), e);
        }
    }

    // random suffix keeps decisions from the same millisecond, on any node, apart
    static String auditKey(AdaptiveDecision decision) {
        return PREFIX + decision.getTimestamp().toEpochMilli() + ":"
                + UUID.randomUUID().toString().substring(0, 8);
    }
}
