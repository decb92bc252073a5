package com.equixtate.onboarding.property;

import com.equixtate.common.ErrorKind;
import com.equixtate.common.OnboardingException;
import com.equixtate.common.PrefixedIds;
import com.equixtate.domain.DocumentKind;
import com.equixtate.domain.DocumentMetadata;
import com.equixtate.domain.PropertyDocuments;
import com.equixtate.domain.PropertyFields;
import com.equixtate.domain.PropertyOnboarding;
import com.equixtate.domain.PropertyStatus;
import com.equixtate.domain.StatusChange;
import com.equixtate.domain.SubjectKind;
import com.equixtate.domain.Tokenization;
import com.equixtate.domain.VerificationRecord;
import com.equixtate.domain.VerificationResult;
import com.equixtate.fingerprint.DocumentFingerprintService;
import com.equixtate.onboarding.InFlightGuard;
import com.equixtate.onboarding.OnboardingStatusChangedEvent;
import com.equixtate.onboarding.config.OnboardingProperties;
import com.equixtate.oracle.AttestationOracle;
import com.equixtate.oracle.SubjectFields;
import com.equixtate.oracle.VerificationRequest;
import com.equixtate.store.OnboardingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives a property listing from submission through oracle verification to tokenization.
 * <p>
 * Verification persists a VERIFICATION_IN_PROGRESS claim before calling the oracle and writes the
 * outcome afterwards. A retryable oracle fault restores the pre-call status. Tokenization only
 * persists once the registry has accepted the property.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PropertyOnboardingWorkflow {

    /** Writes retried after a version conflict with a concurrent admin note. */
    static final int MAX_WRITE_ATTEMPTS = 3;

    private final OnboardingStore<PropertyOnboarding> store;
    private final DocumentFingerprintService fingerprintService;
    private final AttestationOracle oracle;
    private final TokenRegistry tokenRegistry;
    private final OnboardingProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final InFlightGuard guard = new InFlightGuard();

    /**
     * Validates the submission, fingerprints every upload and stores a DOCUMENTS_SUBMITTED record.
     *
     * @throws OnboardingException VALIDATION / INVALID_FIELDS for missing owner, name, location, non-positive
     *                             price or missing deed; EMPTY_DOCUMENT for a zero-length upload
     */
    public PropertyOnboarding createOnboarding(PropertySubmission submission) {
        validate(submission);
        PropertyDocuments documents = new PropertyDocuments(
                fingerprintService.fingerprintAll(submission.images(), DocumentKind.PROPERTY_IMAGE),
                fingerprintService.fingerprintAll(submission.supportingDocs(), DocumentKind.TAX_RECORD),
                fingerprintService.fingerprint(submission.deed(), DocumentKind.PROPERTY_DEED));

        Instant now = clock.instant();
        PropertyOnboarding draft = PropertyOnboarding.draft(PrefixedIds.next(PrefixedIds.PROPERTY, clock),
                submission.ownerPrincipal(), submission.fields(), documents, now);
        draft.transitionTo(PropertyStatus.DOCUMENTS_SUBMITTED, now);
        PropertyOnboarding saved = store.upsert(draft);
        log.info("Property onboarding {} created for {} ({} documents)", saved.getId(), saved.getOwnerPrincipal(),
                documents.images().size() + documents.supportingDocs().size() + 1);
        publish(saved, PropertyStatus.DRAFT);
        return saved;
    }

    /**
     * Sends the record's fingerprints to the oracle and records the verdict:
     * VERIFIED to VERIFICATION_COMPLETE, REJECTED to REJECTED, NEEDS_REVIEW to VERIFICATION_PENDING.
     *
     * @throws OnboardingException NOT_FOUND; TRANSITION / INVALID_TRANSITION from any other state;
     *                             CONCURRENCY_CONFLICT when a verification for id is already running;
     *                             ORACLE_UNAVAILABLE after the pre-call status was restored; STORAGE when the
     *                             verdict could not be written (pre-call status restored where possible)
     */
    public VerificationResult submitForVerification(String id) {
        guard.acquire(id);
        try {
            PropertyOnboarding current = getOnboarding(id);
            Instant now = clock.instant();
            PropertyStatus restoreTo = claimableFrom(current, now);

            PropertyOnboarding claim = current.copy();
            if (current.getStatus() != PropertyStatus.VERIFICATION_IN_PROGRESS) {
                claim.transitionTo(PropertyStatus.VERIFICATION_IN_PROGRESS, now);
            } else {
                log.warn("Re-claiming stale verification of {} (claimed at {})", id, current.getUpdatedAt());
            }
            claim = store.upsert(claim);
            publish(claim, current.getStatus());
            Instant submittedAt = claim.getUpdatedAt();

            VerificationResult result;
            try {
                result = oracle.verifyProperty(toRequest(claim));
            } catch (RuntimeException e) {
                restore(claim, restoreTo, e);
                throw e;
            }

            PropertyOnboarding completed = complete(claim, result, submittedAt, restoreTo);
            log.info("Property {} verification {} -> {} via {}", id, result.verificationId(), completed.getStatus(),
                    result.verifiedBy());
            publish(completed, PropertyStatus.VERIFICATION_IN_PROGRESS);
            return result;
        } finally {
            guard.release(id);
        }
    }

    /**
     * Registers a verified property with the token registry and lists it.
     * Nothing is persisted until the registry succeeds, so a failure leaves the record in VERIFICATION_COMPLETE.
     *
     * @throws OnboardingException TRANSITION / PRECONDITION_FAILED unless verified; REGISTRY_UNAVAILABLE when
     *                             the registry fails
     */
    public PropertyOnboarding tokenize(String id) {
        guard.acquire(id);
        try {
            PropertyOnboarding current = getOnboarding(id);
            if (current.getStatus() != PropertyStatus.VERIFICATION_COMPLETE) {
                throw OnboardingException.transition(OnboardingException.PRECONDITION_FAILED,
                        "Property " + id + " must be verified before tokenization (status " + current.getStatus() + ")");
            }
            PropertyOnboarding working = current.copy();
            working.transitionTo(PropertyStatus.TOKENIZATION_IN_PROGRESS, clock.instant());

            BigDecimal unitPrice = properties.getTokenUnitPrice();
            BigInteger totalTokens = totalTokens(working.getPropertyFields().price(), unitPrice);
            DocumentMetadata deed = working.getDocuments() != null ? working.getDocuments().deed() : null;
            TokenizationReceipt receipt;
            try {
                receipt = tokenRegistry.register(new TokenizationRequest(id, working.getOwnerPrincipal(),
                        working.getPropertyFields().name(), working.getPropertyFields().location(),
                        working.getPropertyFields().price(), deed != null ? deed.contentHash() : null, totalTokens));
            } catch (RuntimeException e) {
                log.warn("Token registry failed for {}; staying in {}", id, current.getStatus(), e);
                throw OnboardingException.registryUnavailable("Token registry failed for " + id + ": "
                        + e.getMessage(), e);
            }

            Instant listedAt = clock.instant();
            working.markListed(new Tokenization(receipt.registryReference(), receipt.tokenId(), totalTokens,
                    unitPrice, receipt.transactionHash(), listedAt), listedAt);
            PropertyOnboarding saved = store.upsert(working);
            log.info("Property {} listed as token {} ({} tokens at {})", id, receipt.tokenId(), totalTokens,
                    unitPrice);
            publish(saved, current.getStatus());
            return saved;
        } finally {
            guard.release(id);
        }
    }

    /**
     * Appends an admin note. Allowed in every state, including while a verification is running;
     * status is never touched. A version conflict re-reads the record and appends again.
     */
    public PropertyOnboarding annotate(String id, String note) {
        if (note == null || note.isBlank()) {
            throw OnboardingException.validation(OnboardingException.INVALID_FIELDS, "Note must not be blank");
        }
        for (int attempt = 1; ; attempt++) {
            PropertyOnboarding record = getOnboarding(id);
            record.addAdminNote(note.strip(), clock.instant());
            try {
                return store.upsert(record);
            } catch (OnboardingException e) {
                if (e.getKind() != ErrorKind.CONCURRENCY_CONFLICT || attempt >= MAX_WRITE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Note on {} lost a version race (attempt {}); retrying", id, attempt);
            }
        }
    }

    /**
     * @throws OnboardingException NOT_FOUND when no record has this id
     */
    public PropertyOnboarding getOnboarding(String id) {
        return store.get(id)
                .orElseThrow(() -> OnboardingException.notFound("Property onboarding not found: " + id));
    }

    public List<PropertyOnboarding> getByPrincipal(String ownerPrincipal) {
        return store.findByPrincipal(ownerPrincipal);
    }

    /** Records awaiting a verification outcome (VERIFICATION_PENDING or VERIFICATION_IN_PROGRESS). */
    public List<PropertyOnboarding> listPending() {
        return store.listAll().stream()
                .filter(p -> p.getStatus() != null && p.getStatus().isPendingVerification())
                .toList();
    }

    public List<PropertyOnboarding> listAll() {
        return store.listAll();
    }

    /** floor(price / unitPrice); zero when either side is missing or non-positive. */
    static BigInteger totalTokens(BigDecimal price, BigDecimal unitPrice) {
        if (price == null || unitPrice == null || unitPrice.signum() <= 0 || price.signum() <= 0) {
            return BigInteger.ZERO;
        }
        return price.divide(unitPrice, 0, RoundingMode.FLOOR).toBigIntegerExact();
    }

    /**
     * Checks that current may be claimed for verification and returns the status to restore on a
     * retryable failure.
     */
    private PropertyStatus claimableFrom(PropertyOnboarding current, Instant now) {
        PropertyStatus status = current.getStatus();
        if (status == PropertyStatus.DOCUMENTS_SUBMITTED || status == PropertyStatus.VERIFICATION_PENDING) {
            return status;
        }
        if (status == PropertyStatus.VERIFICATION_IN_PROGRESS) {
            if (!isStale(current, now)) {
                throw OnboardingException.alreadyInProgress(current.getId());
            }
            return statusBeforeClaim(current);
        }
        throw OnboardingException.transition(OnboardingException.INVALID_TRANSITION,
                "Property " + current.getId() + " cannot be submitted for verification from " + status);
    }

    private boolean isStale(PropertyOnboarding claim, Instant now) {
        Duration age = Duration.between(claim.getUpdatedAt(), now);
        return age.compareTo(properties.getStaleClaimAfter()) > 0;
    }

    private static PropertyStatus statusBeforeClaim(PropertyOnboarding claim) {
        List<StatusChange> history = claim.getStatusHistory();
        if (!history.isEmpty()) {
            StatusChange last = history.get(history.size() - 1);
            if (PropertyStatus.VERIFICATION_PENDING.name().equals(last.from())) {
                return PropertyStatus.VERIFICATION_PENDING;
            }
        }
        return PropertyStatus.DOCUMENTS_SUBMITTED;
    }

    /**
     * Writes the verdict onto the claim. If an admin note landed on the claim meanwhile, the verdict is
     * re-applied to the latest copy; any other write failure restores the pre-call status.
     */
    private PropertyOnboarding complete(PropertyOnboarding claim, VerificationResult result, Instant submittedAt,
                                        PropertyStatus restoreTo) {
        PropertyOnboarding base = claim;
        for (int attempt = 1; ; attempt++) {
            PropertyOnboarding completed = base.copy();
            Instant completedAt = clock.instant();
            completed.transitionTo(statusFor(result), completedAt);
            completed.setVerification(VerificationRecord.of(result, submittedAt, completedAt, null));
            try {
                return store.upsert(completed);
            } catch (OnboardingException e) {
                if (e.getKind() == ErrorKind.CONCURRENCY_CONFLICT && attempt < MAX_WRITE_ATTEMPTS) {
                    Optional<PropertyOnboarding> latest = store.get(base.getId());
                    if (latest.isPresent() && latest.get().getStatus() == PropertyStatus.VERIFICATION_IN_PROGRESS) {
                        log.info("Property {} changed during verification; applying {} to version {}",
                                base.getId(), result.verificationId(), latest.get().getVersion());
                        base = latest.get();
                        continue;
                    }
                }
                restore(base, restoreTo, e);
                throw e;
            }
        }
    }

    private void restore(PropertyOnboarding claim, PropertyStatus restoreTo, RuntimeException cause) {
        log.warn("Verification of {} failed ({}); restoring {}", claim.getId(), cause.getMessage(), restoreTo);
        PropertyOnboarding restored = claim.copy();
        restored.transitionTo(restoreTo, clock.instant());
        try {
            restored = store.upsert(restored);
            publish(restored, PropertyStatus.VERIFICATION_IN_PROGRESS);
        } catch (OnboardingException e) {
            log.error("Could not restore {} to {}; claim stays until stale", claim.getId(), restoreTo, e);
            cause.addSuppressed(e);
        }
    }

    private static PropertyStatus statusFor(VerificationResult result) {
        return switch (result.verdict()) {
            case VERIFIED -> PropertyStatus.VERIFICATION_COMPLETE;
            case REJECTED -> PropertyStatus.REJECTED;
            case NEEDS_REVIEW -> PropertyStatus.VERIFICATION_PENDING;
        };
    }

    private static VerificationRequest toRequest(PropertyOnboarding record) {
        List<String> hashes = new ArrayList<>();
        PropertyDocuments documents = record.getDocuments();
        if (documents != null) {
            if (documents.deed() != null) {
                hashes.add(documents.deed().contentHash());
            }
            documents.supportingDocs().forEach(d -> hashes.add(d.contentHash()));
        }
        PropertyFields fields = record.getPropertyFields();
        return new VerificationRequest(record.getId(), SubjectKind.PROPERTY, record.getOwnerPrincipal(), hashes,
                new SubjectFields(fields.name(), fields.location(), fields.price(), fields.propertyType()));
    }

    private static void validate(PropertySubmission submission) {
        List<String> problems = new ArrayList<>();
        if (submission == null) {
            throw OnboardingException.validation(OnboardingException.INVALID_FIELDS, "Submission is required");
        }
        if (isBlank(submission.ownerPrincipal())) {
            problems.add("owner");
        }
        PropertyFields fields = submission.fields();
        if (fields == null) {
            problems.add("fields");
        } else {
            if (isBlank(fields.name())) {
                problems.add("name");
            }
            if (isBlank(fields.location())) {
                problems.add("location");
            }
            if (fields.price() == null || fields.price().signum() <= 0) {
                problems.add("price");
            }
        }
        if (submission.deed() == null) {
            problems.add("deed");
        }
        if (!problems.isEmpty()) {
            throw OnboardingException.validation(OnboardingException.INVALID_FIELDS,
                    "Missing or invalid: " + String.join(", ", problems));
        }
    }

    private void publish(PropertyOnboarding record, PropertyStatus from) {
        eventPublisher.publishEvent(new OnboardingStatusChangedEvent(SubjectKind.PROPERTY, record.getId(),
                from != null ? from.name() : null, record.getStatus().name(), record.getVersion(),
                record.getUpdatedAt()));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
