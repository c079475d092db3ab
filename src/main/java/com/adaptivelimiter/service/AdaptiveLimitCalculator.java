package com.adaptivelimiter.service;

import com.adaptivelimiter.model.SystemLoad;
import com.adaptivelimiter.model.UserBehavior;
import org.springframework.stereotype.Component;

/**
 * Scales a base limit from behavior and load signals. Factors apply independently and
 * multiply together; the product is clamped to [{@value #MIN_MULTIPLIER}, {@value #MAX_MULTIPLIER}].
 */
@Component
public class AdaptiveLimitCalculator {

    static final double MIN_MULTIPLIER = 0.1;
    static final double MAX_MULTIPLIER = 3.0;

    public double multiplier(UserBehavior behavior, SystemLoad load) {
        double multiplier = 1.0;

        // user behavior
        if (behavior.getErrorRate() < 0.01) multiplier *= 1.5;
        if (behavior.getErrorRate() > 0.1) multiplier *= 0.5;

        if (behavior.getAvgResponseTime() < 100) multiplier *= 1.2;
        if (behavior.getAvgResponseTime() > 500) multiplier *= 0.8;

        if (behavior.getBurstiness() > 0.8) multiplier *= 0.7;
        if (behavior.getConsistency() > 0.9) multiplier *= 1.3;

        multiplier *= 0.5 + behavior.getReputation();

        // system load
        if (load.getCpu() < 50) multiplier *= 1.2;
        if (load.getCpu() > 80) multiplier *= 0.6;

        if (load.getErrorRate() < 0.01) multiplier *= 1.1;
        if (load.getErrorRate() > 0.05) multiplier *= 0.7;

        // NaN from a bad signal collapses to the floor
        if (Double.isNaN(multiplier)) {
            return MIN_MULTIPLIER;
        }
        return Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, multiplier));
    }

    public int adjustedLimit(int baseLimit, double multiplier) {
        return (int) Math.floor(baseLimit * multiplier);
    }
}
