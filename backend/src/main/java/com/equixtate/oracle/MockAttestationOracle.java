package com.equixtate.oracle;

import com.equixtate.common.ContentHash;
import com.equixtate.common.PrefixedIds;
import com.equixtate.domain.Verdict;
import com.equixtate.domain.VerificationChecks;
import com.equixtate.domain.VerificationResult;
import com.equixtate.domain.VerificationSource;
import com.equixtate.oracle.config.OracleProperties;

import java.time.Clock;
import java.util.List;

/**
 * Deterministic stand-in used when the live oracle is not configured. Always verifies; results are
 * distinguishable from live ones by verifiedBy=MOCK_ORACLE and crossAttested=false.
 */
public class MockAttestationOracle implements AttestationOracle {

    private final Clock clock;
    private final OracleProperties properties;

    public MockAttestationOracle(Clock clock, OracleProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    @Override
    public VerificationResult verifyProperty(VerificationRequest request) {
        return verify(request, "Property verified by mock oracle (cross-attestation skipped)");
    }

    @Override
    public VerificationResult verifyUser(VerificationRequest request) {
        return verify(request, "Identity verified by mock oracle (cross-attestation skipped)");
    }

    @Override
    public OracleMode mode() {
        return OracleMode.MOCK;
    }

    @Override
    public OracleStatus status() {
        return properties.status(OracleMode.MOCK);
    }

    private VerificationResult verify(VerificationRequest request, String notes) {
        long now = clock.millis();
        String seed = "mock-" + request.subjectKind() + "-" + request.subjectId() + "-" + now;
        return VerificationResult.builder()
                .success(true)
                .verdict(Verdict.VERIFIED)
                .verificationId(PrefixedIds.next(PrefixedIds.VERIFICATION, clock))
                .attestationHash(ContentHash.of(seed))
                .checks(new VerificationChecks(true, true, false))
                .errors(List.of())
                .verifiedBy(VerificationSource.MOCK_ORACLE)
                .notes(notes)
                .timestamp(clock.instant())
                .build();
    }
}
