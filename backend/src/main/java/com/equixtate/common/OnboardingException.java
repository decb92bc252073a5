package com.equixtate.common;

import lombok.Getter;

/**
 * Thrown by the fingerprint service, oracle adapter, stores and workflows.
 * Carries a coarse {@link ErrorKind} and a fine-grained error code (e.g. INCOMPLETE_SUBMISSION).
 */
@Getter
public class OnboardingException extends RuntimeException {

    public static final String EMPTY_DOCUMENT = "EMPTY_DOCUMENT";
    public static final String INVALID_FIELDS = "INVALID_FIELDS";
    public static final String INCOMPLETE_SUBMISSION = "INCOMPLETE_SUBMISSION";
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String PRECONDITION_FAILED = "PRECONDITION_FAILED";
    public static final String VERIFICATION_ALREADY_IN_PROGRESS = "VERIFICATION_ALREADY_IN_PROGRESS";
    public static final String VERSION_CONFLICT = "VERSION_CONFLICT";
    public static final String ORACLE_UNAVAILABLE = "ORACLE_UNAVAILABLE";
    public static final String ORACLE_REJECTED = "ORACLE_REJECTED";
    public static final String STORAGE_ERROR = "STORAGE_ERROR";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String REGISTRY_UNAVAILABLE = "REGISTRY_UNAVAILABLE";

    private final ErrorKind kind;
    private final String errorCode;

    public OnboardingException(ErrorKind kind, String errorCode, String message) {
        super(message);
        this.kind = kind;
        this.errorCode = errorCode;
    }

    public OnboardingException(ErrorKind kind, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
    }

    public static OnboardingException validation(String errorCode, String message) {
        return new OnboardingException(ErrorKind.VALIDATION, errorCode, message);
    }

    public static OnboardingException transition(String errorCode, String message) {
        return new OnboardingException(ErrorKind.TRANSITION, errorCode, message);
    }

    public static OnboardingException oracleUnavailable(String message, Throwable cause) {
        return new OnboardingException(ErrorKind.ORACLE_UNAVAILABLE, ORACLE_UNAVAILABLE, message, cause);
    }

    public static OnboardingException oracleRejected(String message) {
        return new OnboardingException(ErrorKind.ORACLE_REJECTED, ORACLE_REJECTED, message);
    }

    public static OnboardingException alreadyInProgress(String id) {
        return new OnboardingException(ErrorKind.CONCURRENCY_CONFLICT, VERIFICATION_ALREADY_IN_PROGRESS,
                "Verification already in progress for " + id);
    }

    public static OnboardingException versionConflict(String id, Throwable cause) {
        return new OnboardingException(ErrorKind.CONCURRENCY_CONFLICT, VERSION_CONFLICT,
                "Record " + id + " was modified concurrently", cause);
    }

    public static OnboardingException storage(String message, Throwable cause) {
        return new OnboardingException(ErrorKind.STORAGE, STORAGE_ERROR, message, cause);
    }

    public static OnboardingException notFound(String message) {
        return new OnboardingException(ErrorKind.NOT_FOUND, NOT_FOUND, message);
    }

    public static OnboardingException registryUnavailable(String message, Throwable cause) {
        return new OnboardingException(ErrorKind.REGISTRY_UNAVAILABLE, REGISTRY_UNAVAILABLE, message, cause);
    }

    /** True for faults the caller may retry with the same input. */
    public boolean isRetryable() {
        return kind == ErrorKind.ORACLE_UNAVAILABLE
                || kind == ErrorKind.STORAGE
                || kind == ErrorKind.REGISTRY_UNAVAILABLE;
    }
}
