package com.equixtate.domain;

import java.time.Instant;

/**
 * Verification attempt as stored on a record. expiresAt is only set for user KYC.
 */
public record VerificationRecord(
        String verificationId,
        VerificationResult result,
        Instant submittedAt,
        Instant completedAt,
        Instant expiresAt
) {

    public static VerificationRecord of(VerificationResult result, Instant submittedAt, Instant completedAt,
                                        Instant expiresAt) {
        return new VerificationRecord(result.verificationId(), result, submittedAt, completedAt, expiresAt);
    }

    /** Missing expiry counts as expired, so a verification without one never grants access. */
    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || now.isAfter(expiresAt);
    }
}
