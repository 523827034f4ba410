package com.pennywise.common.model;

/**
 * Outcome of one guarded outbound call. Created per call and never mutated.
 *
 * <p>Failures are reported through this record instead of thrown exceptions, so
 * callers always receive a structured value.
 */
public record ProviderResult<T>(
    boolean success,
    T data,
    String error,
    String source,
    int httpStatus,
    long responseTimeMs,
    int retryCount
) {

    public static <T> ProviderResult<T> success(T data, String source, long responseTimeMs, int retryCount) {
        return new ProviderResult<>(true, data, null, source, 200, responseTimeMs, retryCount);
    }

    public static <T> ProviderResult<T> failure(String error, String source, int httpStatus,
                                                long responseTimeMs, int retryCount) {
        return new ProviderResult<>(false, null, error, source, httpStatus, responseTimeMs, retryCount);
    }

    /** Same result attributed to a different source (used once the routing target is known). */
    public ProviderResult<T> withSource(String newSource) {
        return new ProviderResult<>(success, data, error, newSource, httpStatus, responseTimeMs, retryCount);
    }
}
