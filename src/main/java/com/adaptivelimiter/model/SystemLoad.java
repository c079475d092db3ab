package com.adaptivelimiter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

// global load signals; nullable fields double as a partial update
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SystemLoad {
    // percent
    private Double cpu;
    // percent
    private Double memory;
    // milliseconds
    private Double latency;
    private Double errorRate;

    public static SystemLoad defaults() {
        return new SystemLoad(50.0, 60.0, 100.0, 0.01);
    }

    public SystemLoad withDefaults(SystemLoad base) {
        return new SystemLoad(
                cpu != null ? cpu : base.cpu,
                memory != null ? memory : base.memory,
                latency != null ? latency : base.latency,
                errorRate != null ? errorRate : base.errorRate);
    }

    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        UserBehavior.putIfSet(fields, "cpu", cpu);
        UserBehavior.putIfSet(fields, "memory", memory);
        UserBehavior.putIfSet(fields, "latency", latency);
        UserBehavior.putIfSet(fields, "errorRate", errorRate);
        return fields;
    }

    public static SystemLoad fromFields(Map<String, String> fields) {
        return new SystemLoad(
                UserBehavior.parse(fields.get("cpu")),
                UserBehavior.parse(fields.get("memory")),
                UserBehavior.parse(fields.get("latency")),
                UserBehavior.parse(fields.get("errorRate")));
    }
}
