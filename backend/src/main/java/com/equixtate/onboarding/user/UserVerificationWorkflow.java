package com.equixtate.onboarding.user;

import com.equixtate.common.ErrorKind;
import com.equixtate.common.OnboardingException;
import com.equixtate.compliance.ComplianceScreening;
import com.equixtate.compliance.EntitlementEngine;
import com.equixtate.domain.ComplianceFlags;
import com.equixtate.domain.DocumentKind;
import com.equixtate.domain.DocumentMetadata;
import com.equixtate.domain.KycTier;
import com.equixtate.domain.PersonalInfo;
import com.equixtate.domain.SubjectKind;
import com.equixtate.domain.UserDocuments;
import com.equixtate.domain.UserOnboarding;
import com.equixtate.domain.UserVerificationStatus;
import com.equixtate.domain.VerificationRecord;
import com.equixtate.domain.VerificationResult;
import com.equixtate.fingerprint.DocumentFingerprintService;
import com.equixtate.fingerprint.DocumentUpload;
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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * KYC workflow for wallet principals: submission, oracle verification, tier assignment and the
 * eligibility checks other services ask before letting a user invest or list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserVerificationWorkflow {

    private final OnboardingStore<UserOnboarding> store;
    private final DocumentFingerprintService fingerprintService;
    private final AttestationOracle oracle;
    private final EntitlementEngine entitlementEngine;
    private final ComplianceScreening complianceScreening;
    private final OnboardingProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final InFlightGuard guard = new InFlightGuard();

    /**
     * Returns the principal's record, creating an UNVERIFIED one (tier NONE) on first call.
     */
    public UserOnboarding createOrGetOnboarding(String principal) {
        if (isBlank(principal)) {
            throw OnboardingException.validation(OnboardingException.INVALID_FIELDS, "Wallet principal is required");
        }
        String key = UserOnboarding.key(principal);
        Optional<UserOnboarding> existing = store.get(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            UserOnboarding created = store.upsert(UserOnboarding.unverified(principal,
                    entitlementEngine::entitlementsForTier, clock.instant()));
            log.info("User onboarding created for {}", created.getWalletPrincipal());
            publish(created, null);
            return created;
        } catch (OnboardingException e) {
            if (e.getKind() != ErrorKind.CONCURRENCY_CONFLICT) {
                throw e;
            }
            // created concurrently
            return store.get(key).orElseThrow(() -> e);
        }
    }

    /**
     * Validates and fingerprints the submission, asks the oracle and applies the verdict:
     * VERIFIED grants the target tier until now + kyc-validity, REJECTED resets the tier to NONE,
     * NEEDS_REVIEW parks the record in VERIFICATION_PENDING with the tier unchanged.
     *
     * @throws OnboardingException VALIDATION / INCOMPLETE_SUBMISSION before anything is touched;
     *                             TRANSITION / INVALID_TRANSITION; CONCURRENCY_CONFLICT when a verification
     *                             is already running; ORACLE_UNAVAILABLE after the pre-call record was restored;
     *                             STORAGE when the verdict could not be written
     */
    public VerificationResult submitKYC(KycSubmission submission) {
        validate(submission);
        String key = UserOnboarding.key(submission.principal());
        guard.acquire(key);
        try {
            Instant now = clock.instant();
            UserOnboarding current = store.get(key)
                    .orElseGet(() -> UserOnboarding.unverified(submission.principal(),
                            entitlementEngine::entitlementsForTier, now));
            checkCanSubmit(current, now);

            DocumentMetadata identity = fingerprintService.fingerprint(submission.identity(),
                    DocumentKind.IDENTITY_DOCUMENT);
            DocumentMetadata addressProof = fingerprintService.fingerprint(submission.addressProof(),
                    DocumentKind.PROOF_OF_ADDRESS);

            UserOnboarding claim = current.copy();
            claim.setPersonalInfo(submission.personalInfo());
            claim.setDocuments(new UserDocuments(submission.identityType(), identity, addressProof));
            if (claim.getStatus() != UserVerificationStatus.DOCUMENTS_SUBMITTED) {
                claim.transitionTo(UserVerificationStatus.DOCUMENTS_SUBMITTED, now);
            }
            claim.transitionTo(UserVerificationStatus.VERIFICATION_IN_PROGRESS, now);
            claim = store.upsert(claim);
            publish(claim, current.getStatus());
            Instant submittedAt = claim.getUpdatedAt();

            VerificationResult result;
            try {
                result = oracle.verifyUser(toRequest(claim));
            } catch (RuntimeException e) {
                restore(claim, current, e);
                throw e;
            }

            UserOnboarding completed = claim.copy();
            Instant completedAt = clock.instant();
            applyVerdict(completed, result, submission.effectiveTargetTier(), submittedAt, completedAt);
            try {
                completed = store.upsert(completed);
            } catch (OnboardingException e) {
                restore(claim, current, e);
                throw e;
            }
            log.info("KYC {} for {} -> {} tier {} via {}", result.verificationId(), completed.getWalletPrincipal(),
                    completed.getStatus(), completed.getTier(), result.verifiedBy());
            publish(completed, UserVerificationStatus.VERIFICATION_IN_PROGRESS);
            return result;
        } finally {
            guard.release(key);
        }
    }

    /** True only for a VERIFIED record whose verification has not expired. Never writes. */
    public boolean isVerified(String principal) {
        return getByPrincipal(principal).map(u -> u.isVerifiedAt(clock.instant())).orElse(false);
    }

    /** Stored status with expiry applied; UNVERIFIED for unknown principals. */
    public UserVerificationStatus effectiveStatus(String principal) {
        return getByPrincipal(principal)
                .map(u -> u.effectiveStatus(clock.instant()))
                .orElse(UserVerificationStatus.UNVERIFIED);
    }

    public KycTier getTier(String principal) {
        return getByPrincipal(principal).map(UserOnboarding::getTier).orElse(KycTier.NONE);
    }

    /**
     * @throws OnboardingException VALIDATION / INVALID_FIELDS for a missing or negative amount
     */
    public Eligibility canInvest(String principal, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw OnboardingException.validation(OnboardingException.INVALID_FIELDS,
                    "Investment amount must be zero or positive");
        }
        Optional<UserOnboarding> found = getByPrincipal(principal);
        if (found.isEmpty()) {
            return Eligibility.denied(Eligibility.NOT_ONBOARDED);
        }
        UserOnboarding user = found.get();
        if (!user.isVerifiedAt(clock.instant())) {
            return Eligibility.denied(Eligibility.KYC_REQUIRED);
        }
        if (!user.getEntitlements().maxInvestment().permits(amount)) {
            return Eligibility.denied("Investment exceeds limit of $" + user.getEntitlements().maxInvestment());
        }
        ComplianceFlags compliance = user.getCompliance();
        if (!compliance.amlPassed()) {
            return Eligibility.denied(Eligibility.AML_REQUIRED);
        }
        if (!compliance.sanctionsPassed()) {
            return Eligibility.denied(Eligibility.SANCTIONS_REQUIRED);
        }
        return Eligibility.granted();
    }

    public Eligibility canListProperty(String principal) {
        Optional<UserOnboarding> found = getByPrincipal(principal);
        if (found.isEmpty()) {
            return Eligibility.denied(Eligibility.NOT_ONBOARDED);
        }
        UserOnboarding user = found.get();
        if (!user.isVerifiedAt(clock.instant())) {
            return Eligibility.denied(Eligibility.KYC_REQUIRED);
        }
        if (!user.getEntitlements().canList()) {
            return Eligibility.denied(Eligibility.LISTING_REQUIRES_ENHANCED);
        }
        return Eligibility.granted();
    }

    /** Case-insensitive lookup. */
    public Optional<UserOnboarding> getByPrincipal(String principal) {
        if (isBlank(principal)) {
            return Optional.empty();
        }
        return store.get(UserOnboarding.key(principal));
    }

    public List<UserOnboarding> listPending() {
        return store.listAll().stream()
                .filter(u -> u.getStatus() != null && u.getStatus().isPendingVerification())
                .toList();
    }

    private void applyVerdict(UserOnboarding record, VerificationResult result, KycTier targetTier,
                              Instant submittedAt, Instant completedAt) {
        switch (result.verdict()) {
            case VERIFIED -> {
                record.transitionTo(UserVerificationStatus.VERIFIED, completedAt);
                record.assignTier(targetTier, entitlementEngine::entitlementsForTier);
                record.setCompliance(complianceScreening.screen(record,
                        entitlementEngine.complianceForTier(targetTier)));
                record.setVerification(VerificationRecord.of(result, submittedAt, completedAt,
                        completedAt.plus(properties.getKycValidity())));
            }
            case REJECTED -> {
                record.transitionTo(UserVerificationStatus.REJECTED, completedAt);
                record.assignTier(KycTier.NONE, entitlementEngine::entitlementsForTier);
                record.setCompliance(ComplianceFlags.NOT_SCREENED);
                record.setVerification(VerificationRecord.of(result, submittedAt, completedAt, null));
            }
            case NEEDS_REVIEW -> {
                record.transitionTo(UserVerificationStatus.VERIFICATION_PENDING, completedAt);
                record.setVerification(VerificationRecord.of(result, submittedAt, completedAt, null));
            }
        }
    }

    private void checkCanSubmit(UserOnboarding current, Instant now) {
        UserVerificationStatus status = current.getStatus();
        if (status == UserVerificationStatus.VERIFICATION_IN_PROGRESS) {
            Duration age = Duration.between(current.getUpdatedAt(), now);
            if (age.compareTo(properties.getStaleClaimAfter()) <= 0) {
                throw OnboardingException.alreadyInProgress(current.getWalletPrincipal());
            }
            log.warn("Re-claiming stale KYC verification of {} (claimed at {})", current.getWalletPrincipal(),
                    current.getUpdatedAt());
            return;
        }
        // left here by an earlier oracle outage
        if (status == UserVerificationStatus.DOCUMENTS_SUBMITTED) {
            return;
        }
        if (!status.canTransitionTo(UserVerificationStatus.DOCUMENTS_SUBMITTED)) {
            throw OnboardingException.transition(OnboardingException.INVALID_TRANSITION,
                    "User " + current.getWalletPrincipal() + " cannot submit KYC from " + status);
        }
    }

    /**
     * Puts the pre-call record back after a failed oracle call or verdict write. When the pre-call status is
     * not reachable from the claim (a new or stale record) the user lands in DOCUMENTS_SUBMITTED with the
     * submitted documents, from which {@link #submitKYC} accepts a retry.
     */
    private void restore(UserOnboarding claim, UserOnboarding previous, RuntimeException cause) {
        UserOnboarding restored = claim.copy();
        Instant now = clock.instant();
        if (claim.getStatus().canTransitionTo(previous.getStatus())) {
            restored.setPersonalInfo(previous.getPersonalInfo());
            restored.setDocuments(previous.getDocuments());
            restored.setVerification(previous.getVerification());
            restored.setCompliance(previous.getCompliance());
            restored.assignTier(previous.getTier(), entitlementEngine::entitlementsForTier);
            restored.transitionTo(previous.getStatus(), now);
        } else {
            restored.transitionTo(UserVerificationStatus.DOCUMENTS_SUBMITTED, now);
        }
        log.warn("KYC of {} failed ({}); restoring {}", claim.getWalletPrincipal(), cause.getMessage(),
                restored.getStatus());
        try {
            restored = store.upsert(restored);
            publish(restored, UserVerificationStatus.VERIFICATION_IN_PROGRESS);
        } catch (OnboardingException e) {
            log.error("Could not restore {}; claim stays until stale", claim.getWalletPrincipal(), e);
            cause.addSuppressed(e);
        }
    }

    private static VerificationRequest toRequest(UserOnboarding record) {
        List<String> hashes = new ArrayList<>();
        UserDocuments documents = record.getDocuments();
        hashes.add(documents.identity().contentHash());
        hashes.add(documents.addressProof().contentHash());
        PersonalInfo info = record.getPersonalInfo();
        return new VerificationRequest(record.getId(), SubjectKind.USER, record.getWalletPrincipal(), hashes,
                new SubjectFields(info.fullName(), info.country(), null, null));
    }

    private static void validate(KycSubmission submission) {
        if (submission == null) {
            throw OnboardingException.validation(OnboardingException.INCOMPLETE_SUBMISSION, "Submission is required");
        }
        List<String> missing = new ArrayList<>();
        if (isBlank(submission.principal())) {
            missing.add("principal");
        }
        PersonalInfo info = submission.personalInfo();
        if (info == null || isBlank(info.fullName())) {
            missing.add("fullName");
        }
        if (info == null || isBlank(info.email())) {
            missing.add("email");
        }
        if (info == null || isBlank(info.country())) {
            missing.add("country");
        }
        if (isMissing(submission.identity())) {
            missing.add("identityDocument");
        }
        if (isMissing(submission.addressProof())) {
            missing.add("addressProof");
        }
        if (!missing.isEmpty()) {
            throw OnboardingException.validation(OnboardingException.INCOMPLETE_SUBMISSION,
                    "Incomplete KYC submission, missing: " + String.join(", ", missing));
        }
    }

    private void publish(UserOnboarding record, UserVerificationStatus from) {
        eventPublisher.publishEvent(new OnboardingStatusChangedEvent(SubjectKind.USER, record.getId(),
                from != null ? from.name() : null, record.getStatus().name(), record.getVersion(),
                record.getUpdatedAt()));
    }

    private static boolean isMissing(DocumentUpload upload) {
        return upload == null || upload.isEmpty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
