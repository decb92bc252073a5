package com.equixtate.oracle;

import com.equixtate.common.ContentHash;
import com.equixtate.common.OnboardingException;
import com.equixtate.common.PrefixedIds;
import com.equixtate.domain.SubjectKind;
import com.equixtate.domain.Verdict;
import com.equixtate.domain.VerificationChecks;
import com.equixtate.domain.VerificationResult;
import com.equixtate.domain.VerificationSource;
import com.equixtate.oracle.config.OracleProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Live oracle adapter. Runs two local gates (document authenticity, record match) and only then
 * asks the remote oracle for a cross-attested verdict.
 * Retryable faults surface as {@link OnboardingException} ORACLE_UNAVAILABLE; every other failure
 * becomes a REJECTED result.
 */
@Slf4j
public class LiveAttestationOracle implements AttestationOracle {

    private final OracleClient client;
    private final OracleProperties properties;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    public LiveAttestationOracle(OracleClient client, OracleProperties properties, RateLimiter rateLimiter,
                                 Clock clock) {
        this.client = client;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    @Override
    public VerificationResult verifyProperty(VerificationRequest request) {
        return verify(request, properties.getPropertyKernelId());
    }

    @Override
    public VerificationResult verifyUser(VerificationRequest request) {
        return verify(request, properties.getUserKernelId());
    }

    @Override
    public OracleMode mode() {
        return OracleMode.LIVE;
    }

    @Override
    public OracleStatus status() {
        return properties.status(OracleMode.LIVE);
    }

    private VerificationResult verify(VerificationRequest request, String kernelId) {
        String verificationId = PrefixedIds.next(PrefixedIds.VERIFICATION, clock);

        List<String> authenticityErrors = checkDocumentAuthenticity(request.documentHashes());
        if (!authenticityErrors.isEmpty()) {
            return needsReview(verificationId, VerificationChecks.NONE, authenticityErrors,
                    "Document fingerprints failed the authenticity check");
        }
        List<String> recordErrors = checkRecordMatch(request);
        if (!recordErrors.isEmpty()) {
            return needsReview(verificationId, new VerificationChecks(true, false, false), recordErrors,
                    "Submitted fields do not match the record requirements");
        }

        String encodedParams;
        try {
            encodedParams = OracleParamsEncoder.encode(request.ownerPrincipal(),
                    request.structuredFields().declaredValue(), request.documentHashes());
        } catch (IllegalArgumentException e) {
            return rejected(verificationId, "Request could not be encoded: " + e.getMessage());
        }

        if (!rateLimiter.acquirePermission()) {
            log.warn("Oracle rate limiter refused permit for {} {}", request.subjectKind(), request.subjectId());
            throw OnboardingException.oracleUnavailable("Oracle rate limit exceeded", null);
        }

        OracleResponse response;
        try {
            log.debug("Oracle request kernel={} subject={} hashes={}", kernelId, request.subjectId(),
                    request.documentHashes().size());
            response = client.execute(new OracleRequest(request.ownerPrincipal(), kernelId, encodedParams))
                    .timeout(properties.getTimeout())
                    .onErrorMap(TimeoutException.class, e -> new OracleCallException(
                            "Oracle timed out after " + properties.getTimeout().toMillis() + " ms", e, true))
                    .block();
        } catch (OracleCallException e) {
            if (e.isRetryable()) {
                log.warn("Oracle unavailable for {} {}: {}", request.subjectKind(), request.subjectId(),
                        e.getMessage());
                throw OnboardingException.oracleUnavailable(e.getMessage(), e);
            }
            return rejected(verificationId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Oracle call failed for {} {}", request.subjectKind(), request.subjectId(), e);
            return rejected(verificationId, "Oracle call failed: " + e.getMessage());
        }

        if (response == null || response.verdictPayload() == null) {
            return rejected(verificationId, "Oracle returned no verdict payload");
        }
        VerdictPayload verdict;
        try {
            verdict = VerdictPayloadDecoder.decode(response.verdictPayload());
        } catch (IllegalArgumentException e) {
            return rejected(verificationId, "Malformed verdict payload: " + e.getMessage());
        }

        if (!verdict.verified()) {
            return VerificationResult.builder()
                    .success(false)
                    .verdict(Verdict.REJECTED)
                    .verificationId(verificationId)
                    .checks(new VerificationChecks(true, true, false))
                    .errors(List.of("Oracle rejected the " + label(request.subjectKind())))
                    .verifiedBy(VerificationSource.LIVE_ORACLE)
                    .notes("Rejected by oracle kernel " + kernelId)
                    .timestamp(clock.instant())
                    .build();
        }
        log.info("Oracle verified {} {} ({})", request.subjectKind(), request.subjectId(), verificationId);
        return VerificationResult.builder()
                .success(true)
                .verdict(Verdict.VERIFIED)
                .verificationId(verificationId)
                .attestationHash(verdict.attestationHash())
                .checks(new VerificationChecks(true, true, true))
                .verifiedBy(VerificationSource.LIVE_ORACLE)
                .notes("Cross-attested by oracle kernel " + kernelId)
                .timestamp(clock.instant())
                .build();
    }

    static List<String> checkDocumentAuthenticity(List<String> hashes) {
        List<String> errors = new ArrayList<>();
        if (hashes.isEmpty()) {
            errors.add("No documents provided");
            return errors;
        }
        for (String hash : hashes) {
            if (!ContentHash.isWellFormed(hash)) {
                errors.add("Invalid document fingerprint: " + hash);
            }
        }
        return errors;
    }

    static List<String> checkRecordMatch(VerificationRequest request) {
        List<String> errors = new ArrayList<>();
        SubjectFields fields = request.structuredFields();
        if (fields == null) {
            errors.add("Structured fields are missing");
            return errors;
        }
        if (isBlank(fields.name())) {
            errors.add(request.subjectKind() == SubjectKind.PROPERTY ? "Property name is required" : "Full name is required");
        }
        if (isBlank(fields.location())) {
            errors.add(request.subjectKind() == SubjectKind.PROPERTY ? "Property location is required" : "Country is required");
        }
        if (request.subjectKind() == SubjectKind.PROPERTY
                && (fields.declaredValue() == null || fields.declaredValue().compareTo(BigDecimal.ZERO) <= 0)) {
            errors.add("Declared value must be positive");
        }
        return errors;
    }

    private VerificationResult needsReview(String verificationId, VerificationChecks checks, List<String> errors,
                                           String notes) {
        return VerificationResult.builder()
                .success(false)
                .verdict(Verdict.NEEDS_REVIEW)
                .verificationId(verificationId)
                .checks(checks)
                .errors(errors)
                .verifiedBy(VerificationSource.LIVE_ORACLE)
                .notes(notes)
                .timestamp(clock.instant())
                .build();
    }

    private VerificationResult rejected(String verificationId, String error) {
        log.warn("Oracle verification {} rejected: {}", verificationId, error);
        return VerificationResult.builder()
                .success(false)
                .verdict(Verdict.REJECTED)
                .verificationId(verificationId)
                .checks(new VerificationChecks(true, true, false))
                .errors(List.of(error))
                .verifiedBy(VerificationSource.LIVE_ORACLE)
                .notes("Oracle call failed")
                .timestamp(clock.instant())
                .build();
    }

    private static String label(SubjectKind kind) {
        return kind == SubjectKind.PROPERTY ? "property" : "user";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
