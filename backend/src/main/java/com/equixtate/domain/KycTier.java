package com.equixtate.domain;

/**
 * KYC levels gating investment and listing entitlements.
 */
public enum KycTier {
    NONE(0),
    /** Basic identity verification. */
    BASIC(1),
    /** Identity plus address verification. */
    STANDARD(2),
    /** Adds source of funds and accredited investor status. */
    ENHANCED(3);

    private final int level;

    KycTier(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isAtLeast(KycTier other) {
        return other == null || level >= other.level;
    }
}
