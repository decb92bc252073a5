package com.equixtate.compliance;

import com.equixtate.domain.ComplianceFlags;
import com.equixtate.domain.UserOnboarding;
import lombok.extern.slf4j.Slf4j;

/**
 * Default screening: no external lists are consulted, the baseline is returned unchanged.
 * Registered only when no other {@link ComplianceScreening} bean exists.
 */
@Slf4j
public class PassThroughComplianceScreening implements ComplianceScreening {

    @Override
    public ComplianceFlags screen(UserOnboarding onboarding, ComplianceFlags baseline) {
        log.debug("No compliance screening configured; keeping baseline for {}", onboarding.getPrincipal());
        return baseline;
    }
}
