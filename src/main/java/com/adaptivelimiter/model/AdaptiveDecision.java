package com.adaptivelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// audit record for one adaptive check, kept for tuning the multipliers
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdaptiveDecision {
    private String policy;
    private String userId;
    private String ip;
    private int originalLimit;
    private int adjustedLimit;
    private double multiplier;
    private UserBehavior userBehavior;
    private SystemLoad systemLoad;
    private boolean allowed;
    private Instant timestamp;
}
