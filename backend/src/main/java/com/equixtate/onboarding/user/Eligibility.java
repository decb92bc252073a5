package com.equixtate.onboarding.user;

/**
 * Outcome of an eligibility check. reason is null when allowed.
 */
public record Eligibility(boolean allowed, String reason) {

    static final String NOT_ONBOARDED = "User not onboarded";
    static final String KYC_REQUIRED = "KYC verification required";
    static final String AML_REQUIRED = "AML check required";
    static final String SANCTIONS_REQUIRED = "Sanctions screening required";
    static final String LISTING_REQUIRES_ENHANCED = "Upgrade to Enhanced KYC tier to list properties";

    public static Eligibility granted() {
        return new Eligibility(true, null);
    }

    public static Eligibility denied(String reason) {
        return new Eligibility(false, reason);
    }
}
