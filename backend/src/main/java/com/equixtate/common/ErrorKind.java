package com.equixtate.common;

/**
 * Error taxonomy for onboarding operations. The API layer maps each kind to an HTTP status.
 */
public enum ErrorKind {
    /** Missing or malformed input; never reaches the oracle, never mutates the record. */
    VALIDATION,
    /** Operation attempted from an incompatible state; record unchanged. */
    TRANSITION,
    /** Retryable oracle transport fault or timeout; record left in its pre-call state. */
    ORACLE_UNAVAILABLE,
    /** Definitive negative verdict; not retryable without new documents. */
    ORACLE_REJECTED,
    /** A second in-flight operation on the same id, or a lost update detected by version check. */
    CONCURRENCY_CONFLICT,
    /** Persistence layer fault. */
    STORAGE,
    NOT_FOUND,
    /** Token registry unreachable during tokenization; record rolled back to VERIFICATION_COMPLETE. */
    REGISTRY_UNAVAILABLE
}
