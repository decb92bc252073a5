package com.equixtate.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * User KYC states. EXPIRED is never stored: it is derived at read time from a VERIFIED record
 * whose verification has passed its expiry, so it has no inbound or outbound edges.
 */
public enum UserVerificationStatus {
    UNVERIFIED,
    DOCUMENTS_SUBMITTED,
    VERIFICATION_IN_PROGRESS,
    VERIFICATION_PENDING,
    VERIFIED,
    REJECTED,
    EXPIRED;

    public Set<UserVerificationStatus> allowedTransitions() {
        return switch (this) {
            case UNVERIFIED -> EnumSet.of(DOCUMENTS_SUBMITTED);
            case DOCUMENTS_SUBMITTED -> EnumSet.of(VERIFICATION_IN_PROGRESS);
            case VERIFICATION_IN_PROGRESS -> EnumSet.of(VERIFIED, REJECTED, VERIFICATION_PENDING, DOCUMENTS_SUBMITTED);
            // resubmission with new documents
            case VERIFICATION_PENDING, VERIFIED, REJECTED -> EnumSet.of(DOCUMENTS_SUBMITTED);
            case EXPIRED -> EnumSet.noneOf(UserVerificationStatus.class);
        };
    }

    public boolean canTransitionTo(UserVerificationStatus next) {
        return next != null && allowedTransitions().contains(next);
    }

    public boolean isPendingVerification() {
        return this == VERIFICATION_PENDING || this == VERIFICATION_IN_PROGRESS;
    }
}
