package com.equixtate.domain;

/**
 * Which oracle path produced a result. Persisted so mock verifications never pass for live ones.
 */
public enum VerificationSource {
    LIVE_ORACLE,
    MOCK_ORACLE
}
