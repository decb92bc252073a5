package com.equixtate.compliance;

import com.equixtate.domain.ComplianceFlags;
import com.equixtate.domain.UserOnboarding;

/**
 * Sanctions / AML / PEP screening hook invoked after a positive KYC verdict.
 * Implementations receive the tier baseline and return the flags to persist.
 */
public interface ComplianceScreening {

    ComplianceFlags screen(UserOnboarding onboarding, ComplianceFlags baseline);
}
