package com.nicedentist.manager.dto;

/**
 * Outcome of a business operation. Rule violations come back as a result with a
 * human-readable message; only infrastructure failures are thrown.
 */
public record ServiceResult<T>(Outcome outcome, String message, T value) {

    public enum Outcome {
        SUCCESS,
        INVALID,
        NOT_FOUND,
        CONFLICT,
        INVALID_STATE,
        FORBIDDEN
    }

    public boolean success() {
        return outcome == Outcome.SUCCESS;
    }

    public static <T> ServiceResult<T> success(String message, T value) {
        return new ServiceResult<>(Outcome.SUCCESS, message, value);
    }

    public static <T> ServiceResult<T> success(String message) {
        return new ServiceResult<>(Outcome.SUCCESS, message, null);
    }

    public static <T> ServiceResult<T> invalid(String message) {
        return new ServiceResult<>(Outcome.INVALID, message, null);
    }

    public static <T> ServiceResult<T> notFound(String message) {
        return new ServiceResult<>(Outcome.NOT_FOUND, message, null);
    }

    public static <T> ServiceResult<T> conflict(String message) {
        return new ServiceResult<>(Outcome.CONFLICT, message, null);
    }

    public static <T> ServiceResult<T> invalidState(String message) {
        return new ServiceResult<>(Outcome.INVALID_STATE, message, null);
    }

    public static <T> ServiceResult<T> forbidden(String message) {
        return new ServiceResult<>(Outcome.FORBIDDEN, message, null);
    }
}
