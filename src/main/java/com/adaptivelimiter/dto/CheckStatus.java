package com.adaptivelimiter.dto;

/**
 * Tags how a decision was reached. {@link #DEGRADED} marks a fail-open allow produced
 * because the counter store or the pipeline failed; it does not change the response contract.
 */
public enum CheckStatus {
    OK,
    DEGRADED
}
