package com.adaptivelimiter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Behavior signals for one identity, fed by an external monitor.
 * Fields are nullable so the same type carries partial updates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserBehavior {
    private Double errorRate;
    // milliseconds
    private Double avgResponseTime;
    private Double burstiness;
    private Double consistency;
    private Double reputation;

    public static UserBehavior defaults() {
        return new UserBehavior(0.05, 200.0, 0.5, 0.8, 0.7);
    }

    // fields not set here are taken from base
    public UserBehavior withDefaults(UserBehavior base) {
        return new UserBehavior(
                errorRate != null ? errorRate : base.errorRate,
                avgResponseTime != null ? avgResponseTime : base.avgResponseTime,
                burstiness != null ? burstiness : base.burstiness,
                consistency != null ? consistency : base.consistency,
                reputation != null ? reputation : base.reputation);
    }

    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        putIfSet(fields, "errorRate", errorRate);
        putIfSet(fields, "avgResponseTime", avgResponseTime);
        putIfSet(fields, "burstiness", burstiness);
        putIfSet(fields, "consistency", consistency);
        putIfSet(fields, "reputation", reputation);
        return fields;
    }

    public static UserBehavior fromFields(Map<String, String> fields) {
        return new UserBehavior(
                parse(fields.get("errorRate")),
                parse(fields.get("avgResponseTime")),
                parse(fields.get("burstiness")),
                parse(fields.get("consistency")),
                parse(fields.get("reputation")));
    }

    static void putIfSet(Map<String, String> fields, String name, Double value) {
        if (value != null) {
            fields.put(name, value.toString());
        }
    }

    static Double parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
