package com.pennywise.common.model;

/**
 * Entry of the capped failure log written when a guarded operation exhausts its retries.
 *
 * @param operation operation name passed to the retry executor
 * @param error     message of the last error
 * @param attempts  total attempts made
 * @param timestamp ISO-8601 instant of the final failure
 */
public record FailureRecord(
    String operation,
    String error,
    int attempts,
    String timestamp
) {}
