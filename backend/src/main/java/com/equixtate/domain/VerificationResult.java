package com.equixtate.domain;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Immutable oracle outcome, embedded into the owning onboarding record.
 *
 * @param verificationId  VRF-prefixed id, generated once per attempt
 * @param attestationHash present for VERIFIED results (live: from the verdict payload; mock: synthesized)
 * @param verifiedBy      LIVE_ORACLE or MOCK_ORACLE
 */
@Builder(toBuilder = true)
public record VerificationResult(
        boolean success,
        Verdict verdict,
        String verificationId,
        String attestationHash,
        VerificationChecks checks,
        List<String> errors,
        VerificationSource verifiedBy,
        String notes,
        Instant timestamp
) {

    public VerificationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        checks = checks == null ? VerificationChecks.NONE : checks;
    }
}
