package com.equixtate.domain;

/**
 * Screening outcome attached to a user record.
 */
public record ComplianceFlags(boolean accreditedInvestor, boolean politicallyExposed, boolean sanctionsPassed,
                              boolean amlPassed) {

    public static final ComplianceFlags NOT_SCREENED = new ComplianceFlags(false, false, false, false);
}
