package com.adaptivelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// partial policy applied when its condition matches; unset fields keep the base policy values
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyOverride {
    private PolicyCondition condition;
    private Integer limit;
    private Integer window;
    // kept as a name so a bad value only fails the checks that hit this override
    private String algorithm;

    public PolicyOverride copy() {
        return new PolicyOverride(condition != null ? condition.copy() : null, limit, window, algorithm);
    }
}
