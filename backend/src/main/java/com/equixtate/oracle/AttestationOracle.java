package com.equixtate.oracle;

import com.equixtate.domain.VerificationResult;

/**
 * Verification oracle as seen by the workflows. Implementations return a well-formed result for every
 * definitive outcome (including REJECTED) and throw {@link com.equixtate.common.OnboardingException}
 * of kind ORACLE_UNAVAILABLE only for retryable faults.
 */
public interface AttestationOracle {

    VerificationResult verifyProperty(VerificationRequest request);

    VerificationResult verifyUser(VerificationRequest request);

    OracleMode mode();

    OracleStatus status();
}
