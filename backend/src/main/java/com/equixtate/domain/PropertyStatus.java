package com.equixtate.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Property onboarding states and the only edges between them.
 * REJECTED and LISTED are terminal. The rollback edges out of the two *_IN_PROGRESS states
 * restore the pre-call state after a retryable oracle or registry failure.
 */
public enum PropertyStatus {
    DRAFT,
    DOCUMENTS_SUBMITTED,
    VERIFICATION_IN_PROGRESS,
    VERIFICATION_PENDING,
    VERIFICATION_COMPLETE,
    AWAITING_TOKENIZATION,
    TOKENIZATION_IN_PROGRESS,
    LISTED,
    REJECTED;

    public Set<PropertyStatus> allowedTransitions() {
        return switch (this) {
            case DRAFT -> EnumSet.of(DOCUMENTS_SUBMITTED);
            case DOCUMENTS_SUBMITTED -> EnumSet.of(VERIFICATION_IN_PROGRESS);
            case VERIFICATION_IN_PROGRESS -> EnumSet.of(VERIFICATION_COMPLETE, VERIFICATION_PENDING, REJECTED,
                    DOCUMENTS_SUBMITTED);
            case VERIFICATION_PENDING -> EnumSet.of(VERIFICATION_IN_PROGRESS);
            case VERIFICATION_COMPLETE -> EnumSet.of(AWAITING_TOKENIZATION, TOKENIZATION_IN_PROGRESS);
            case AWAITING_TOKENIZATION -> EnumSet.of(TOKENIZATION_IN_PROGRESS);
            case TOKENIZATION_IN_PROGRESS -> EnumSet.of(LISTED, VERIFICATION_COMPLETE);
            case LISTED, REJECTED -> EnumSet.noneOf(PropertyStatus.class);
        };
    }

    public boolean canTransitionTo(PropertyStatus next) {
        return next != null && allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == LISTED || this == REJECTED;
    }

    /** States an admin dashboard lists as awaiting a verification outcome. */
    public boolean isPendingVerification() {
        return this == VERIFICATION_PENDING || this == VERIFICATION_IN_PROGRESS;
    }
}
