package com.equixtate.onboarding.user;

import com.equixtate.MutableClock;
import com.equixtate.common.OnboardingException;
import com.equixtate.compliance.ComplianceScreening;
import com.equixtate.compliance.EntitlementEngine;
import com.equixtate.compliance.PassThroughComplianceScreening;
import com.equixtate.domain.Cap;
import com.equixtate.domain.ComplianceFlags;
import com.equixtate.domain.IdentityDocumentType;
import com.equixtate.domain.KycTier;
import com.equixtate.domain.PersonalInfo;
import com.equixtate.domain.UserOnboarding;
import com.equixtate.domain.UserVerificationStatus;
import com.equixtate.domain.Verdict;
import com.equixtate.domain.VerificationChecks;
import com.equixtate.domain.VerificationResult;
import com.equixtate.domain.VerificationSource;
import com.equixtate.fingerprint.DocumentFingerprintService;
import com.equixtate.fingerprint.DocumentUpload;
import com.equixtate.onboarding.config.OnboardingProperties;
import com.equixtate.oracle.AttestationOracle;
import com.equixtate.oracle.VerificationRequest;
import com.equixtate.store.InMemoryOnboardingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserVerificationWorkflowTest {

    private static final String PRINCIPAL = "0xAbCdEf0000000000000000000000000000000001";
    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    AttestationOracle oracle;
    @Mock
    ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private InMemoryOnboardingStore<UserOnboarding> store;
    private OnboardingProperties properties;
    private UserVerificationWorkflow workflow;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryOnboardingStore<>(clock);
        properties = new OnboardingProperties();
        workflow = workflowWith(new PassThroughComplianceScreening());
    }

    private UserVerificationWorkflow workflowWith(ComplianceScreening screening) {
        return new UserVerificationWorkflow(store, new DocumentFingerprintService(clock), oracle,
                new EntitlementEngine(), screening, properties, eventPublisher, clock);
    }

    private static DocumentUpload upload(String name, String content) {
        return new DocumentUpload(name, "image/png", content.getBytes(StandardCharsets.UTF_8));
    }

    private static KycSubmission submission(KycTier tier) {
        PersonalInfo info = PersonalInfo.builder()
                .fullName("Ama Mensah")
                .email("ama@example.com")
                .country("GH")
                .dateOfBirth("1990-04-12")
                .build();
        return new KycSubmission(PRINCIPAL, info, IdentityDocumentType.PASSPORT, upload("passport.png", "passport"),
                upload("bill.png", "utility-bill"), tier);
    }

    private static VerificationResult result(Verdict verdict) {
        return VerificationResult.builder()
                .success(verdict == Verdict.VERIFIED)
                .verdict(verdict)
                .verificationId("VRF-1")
                .checks(new VerificationChecks(true, verdict == Verdict.VERIFIED, false))
                .verifiedBy(VerificationSource.MOCK_ORACLE)
                .timestamp(START)
                .build();
    }

    private static String codeOf(Throwable e) {
        return ((OnboardingException) e).getErrorCode();
    }

    @Test
    @DisplayName("createOrGetOnboarding creates an UNVERIFIED record with tier NONE once")
    void createOrGet() {
        UserOnboarding first = workflow.createOrGetOnboarding(PRINCIPAL);
        UserOnboarding again = workflow.createOrGetOnboarding(PRINCIPAL.toLowerCase());

        assertThat(first.getStatus()).isEqualTo(UserVerificationStatus.UNVERIFIED);
        assertThat(first.getTier()).isEqualTo(KycTier.NONE);
        assertThat(first.getEntitlements().maxInvestment()).isEqualTo(Cap.ZERO);
        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(again.getVersion()).isEqualTo(first.getVersion());
        assertThat(store.listAll()).hasSize(1);
        assertThatThrownBy(() -> workflow.createOrGetOnboarding(" "))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(OnboardingException.INVALID_FIELDS));
    }

    @Test
    @DisplayName("ENHANCED verification grants listing rights and an unlimited investment cap")
    void submitKYC_enhanced() {
        when(oracle.verifyUser(any())).thenReturn(result(Verdict.VERIFIED));

        workflow.submitKYC(submission(KycTier.ENHANCED));

        UserOnboarding user = workflow.getByPrincipal(PRINCIPAL).orElseThrow();
        assertThat(user.getStatus()).isEqualTo(UserVerificationStatus.VERIFIED);
        assertThat(user.getTier()).isEqualTo(KycTier.ENHANCED);
        assertThat(user.getEntitlements().maxInvestment()).isEqualTo(Cap.UNLIMITED);
        assertThat(user.getCompliance().accreditedInvestor()).isTrue();
        assertThat(user.getVerification().expiresAt()).isEqualTo(START.plus(properties.getKycValidity()));
        assertThat(workflow.canListProperty(PRINCIPAL)).isEqualTo(Eligibility.granted());
        assertThat(workflow.canInvest(PRINCIPAL, new BigDecimal("1000000000")).allowed()).isTrue();
        assertThat(workflow.isVerified(PRINCIPAL.toLowerCase())).isTrue();
    }

    @Test
    @DisplayName("oracle request carries identity and address proof hashes plus name and country")
    void submitKYC_request() {
        when(oracle.verifyUser(any())).thenReturn(result(Verdict.VERIFIED));

        workflow.submitKYC(submission(KycTier.BASIC));

        ArgumentCaptor<VerificationRequest> captor = ArgumentCaptor.forClass(VerificationRequest.class);
        verify(oracle).verifyUser(captor.capture());
        UserOnboarding user = workflow.getByPrincipal(PRINCIPAL).orElseThrow();
        assertThat(captor.getValue().documentHashes()).containsExactly(
                user.getDocuments().identity().contentHash(), user.getDocuments().addressProof().contentHash());
        assertThat(captor.getValue().structuredFields().name()).isEqualTo("Ama Mensah");
        assertThat(captor.getValue().structuredFields().location()).isEqualTo("GH");
    }

    @Test
    @DisplayName("missing address proof is INCOMPLETE_SUBMISSION, the oracle is never called and nothing is stored")
    void submitKYC_incomplete() {
        KycSubmission full = submission(KycTier.BASIC);
        KycSubmission missing = new KycSubmission(PRINCIPAL, full.personalInfo(), full.identityType(),
                full.identity(), null, KycTier.BASIC);

        assertThatThrownBy(() -> workflow.submitKYC(missing))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(OnboardingException.INCOMPLETE_SUBMISSION))
                .hasMessageContaining("addressProof");

        verify(oracle, never()).verifyUser(any());
        assertThat(workflow.effectiveStatus(PRINCIPAL)).isEqualTo(UserVerificationStatus.UNVERIFIED);
        assertThat(store.listAll()).isEmpty();
    }

    @Test
    @DisplayName("null target tier is granted as BASIC")
    void submitKYC_defaultTier() {
        when(oracle.verifyUser(any())).thenReturn(result(Verdict.VERIFIED));

        workflow.submitKYC(submission(null));

        assertThat(workflow.getTier(PRINCIPAL)).isEqualTo(KycTier.BASIC);
        assertThat(workflow.canListProperty(PRINCIPAL).reason())
                .isEqualTo(Eligibility.LISTING_REQUIRES_ENHANCED);
    }

    @Test
    @DisplayName("verification expires after kyc-validity: EXPIRED on read, eligibility revoked")
    void expiry() {
        when(oracle.verifyUser(any())).thenReturn(result(Verdict.VERIFIED));
        workflow.submitKYC(submission(KycTier.STANDARD));

        clock.advance(properties.getKycValidity());
        assertThat(workflow.isVerified(PRINCIPAL)).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(workflow.isVerified(PRINCIPAL)).isFalse();
        assertThat(workflow.effectiveStatus(PRINCIPAL)).isEqualTo(UserVerificationStatus.EXPIRED);
        assertThat(workflow.canInvest(PRINCIPAL, BigDecimal.ONE).reason()).isEqualTo(Eligibility.KYC_REQUIRED);
        assertThat(workflow.getByPrincipal(PRINCIPAL).orElseThrow().getStatus())
                .isEqualTo(UserVerificationStatus.VERIFIED);
    }

    @Test
    @DisplayName("canInvest reports not onboarded, missing KYC, the cap, then AML and sanctions")
    void canInvest_reasons() {
        assertThat(workflow.canInvest(PRINCIPAL, BigDecimal.ONE).reason()).isEqualTo(Eligibility.NOT_ONBOARDED);

        workflow.createOrGetOnboarding(PRINCIPAL);
        assertThat(workflow.canInvest(PRINCIPAL, BigDecimal.ONE).reason()).isEqualTo(Eligibility.KYC_REQUIRED);

        when(oracle.verifyUser(any())).thenReturn(result(Verdict.VERIFIED));
        workflow.submitKYC(submission(KycTier.BASIC));
        assertThat(workflow.canInvest(PRINCIPAL, new BigDecimal("10000")).allowed()).isTrue();
        assertThat(workflow.canInvest(PRINCIPAL, new BigDecimal("10000.01")).reason())
                .isEqualTo("Investment exceeds limit of $10000");

        assertThatThrownBy(() -> workflow.canInvest(PRINCIPAL, new BigDecimal("-1")))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(OnboardingException.INVALID_FIELDS));
    }

    @Test
    @DisplayName("failed AML screening blocks investment even when verified")
    void canInvest_amlFailed() {
        UserVerificationWorkflow screened = workflowWith(
                (user, baseline) -> new ComplianceFlags(baseline.accreditedInvestor(), false, true, false));
        when(oracle.verifyUser(any())).thenReturn(result(Verdict.VERIFIED));
        screened.submitKYC(submission(KycTier.BASIC));

        assertThat(screened.canInvest(PRINCIPAL, BigDecimal.TEN).reason()).isEqualTo(Eligibility.AML_REQUIRED);
    }

    @Test
    @DisplayName("a rejected resubmission resets tier and compliance")
    void submitKYC_rejectedResetsTier() {
        when(oracle.verifyUser(any()))
                .thenReturn(result(Verdict.VERIFIED))
                .thenReturn(result(Verdict.REJECTED));
        workflow.submitKYC(submission(KycTier.STANDARD));

        workflow.submitKYC(submission(KycTier.ENHANCED));

        UserOnboarding user = workflow.getByPrincipal(PRINCIPAL).orElseThrow();
        assertThat(user.getStatus()).isEqualTo(UserVerificationStatus.REJECTED);
        assertThat(user.getTier()).isEqualTo(KycTier.NONE);
        assertThat(user.getCompliance()).isEqualTo(ComplianceFlags.NOT_SCREENED);
        assertThat(workflow.isVerified(PRINCIPAL)).isFalse();
    }

    @Test
    @DisplayName("NEEDS_REVIEW parks the user in VERIFICATION_PENDING with tier unchanged")
    void submitKYC_needsReview() {
        when(oracle.verifyUser(any())).thenReturn(result(Verdict.NEEDS_REVIEW));

        workflow.submitKYC(submission(KycTier.BASIC));

        assertThat(workflow.effectiveStatus(PRINCIPAL)).isEqualTo(UserVerificationStatus.VERIFICATION_PENDING);
        assertThat(workflow.getTier(PRINCIPAL)).isEqualTo(KycTier.NONE);
        assertThat(workflow.listPending()).extracting(UserOnboarding::getId).containsExactly(PRINCIPAL.toLowerCase());
    }

    @Test
    @DisplayName("oracle outage on a first submission leaves DOCUMENTS_SUBMITTED and a retry succeeds")
    void submitKYC_unavailableFirstSubmissionThenRetry() {
        when(oracle.verifyUser(any()))
                .thenThrow(OnboardingException.oracleUnavailable("timeout", null))
                .thenReturn(result(Verdict.VERIFIED));

        assertThatThrownBy(() -> workflow.submitKYC(submission(KycTier.BASIC)))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(OnboardingException.ORACLE_UNAVAILABLE));

        UserOnboarding user = workflow.getByPrincipal(PRINCIPAL).orElseThrow();
        assertThat(user.getStatus()).isEqualTo(UserVerificationStatus.DOCUMENTS_SUBMITTED);
        assertThat(user.getTier()).isEqualTo(KycTier.NONE);

        clock.advance(Duration.ofMinutes(1));
        workflow.submitKYC(submission(KycTier.BASIC));

        UserOnboarding retried = workflow.getByPrincipal(PRINCIPAL).orElseThrow();
        assertThat(retried.getStatus()).isEqualTo(UserVerificationStatus.VERIFIED);
        assertThat(retried.getTier()).isEqualTo(KycTier.BASIC);
        assertThat(workflow.isVerified(PRINCIPAL)).isTrue();
    }

    @Test
    @DisplayName("repeated outages keep the user resubmittable from DOCUMENTS_SUBMITTED")
    void submitKYC_repeatedOutages() {
        when(oracle.verifyUser(any())).thenThrow(OnboardingException.oracleUnavailable("timeout", null));

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> workflow.submitKYC(submission(KycTier.BASIC)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(OnboardingException.ORACLE_UNAVAILABLE));
        }

        assertThat(workflow.effectiveStatus(PRINCIPAL)).isEqualTo(UserVerificationStatus.DOCUMENTS_SUBMITTED);
        assertThat(workflow.listPending()).isEmpty();
    }

    @Test
    @DisplayName("oracle outage during re-verification restores the previous verified state")
    void submitKYC_unavailableRestoresVerified() {
        when(oracle.verifyUser(any()))
                .thenReturn(result(Verdict.VERIFIED))
                .thenThrow(OnboardingException.oracleUnavailable("timeout", null));
        workflow.submitKYC(submission(KycTier.STANDARD));
        UserOnboarding before = workflow.getByPrincipal(PRINCIPAL).orElseThrow();

        assertThatThrownBy(() -> workflow.submitKYC(submission(KycTier.ENHANCED)))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(OnboardingException.ORACLE_UNAVAILABLE));

        UserOnboarding after = workflow.getByPrincipal(PRINCIPAL).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(UserVerificationStatus.VERIFIED);
        assertThat(after.getTier()).isEqualTo(KycTier.STANDARD);
        assertThat(after.getVerification()).isEqualTo(before.getVerification());
        assertThat(workflow.isVerified(PRINCIPAL)).isTrue();
    }

    @Test
    @DisplayName("a verification already in progress blocks a second submission until the claim is stale")
    void submitKYC_inProgress() {
        UserOnboarding orphan = UserOnboarding.unverified(PRINCIPAL, new EntitlementEngine()::entitlementsForTier,
                clock.instant());
        orphan.transitionTo(UserVerificationStatus.DOCUMENTS_SUBMITTED, clock.instant());
        orphan.transitionTo(UserVerificationStatus.VERIFICATION_IN_PROGRESS, clock.instant());
        store.upsert(orphan);

        assertThatThrownBy(() -> workflow.submitKYC(submission(KycTier.BASIC)))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(OnboardingException.VERIFICATION_ALREADY_IN_PROGRESS));

        clock.advance(properties.getStaleClaimAfter().plusSeconds(1));
        when(oracle.verifyUser(any())).thenReturn(result(Verdict.VERIFIED));
        workflow.submitKYC(submission(KycTier.BASIC));

        assertThat(workflow.isVerified(PRINCIPAL)).isTrue();
    }
}
