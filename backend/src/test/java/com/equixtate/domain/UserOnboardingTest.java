package com.equixtate.domain;

import com.equixtate.compliance.EntitlementEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class UserOnboardingTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final EntitlementEngine engine = new EntitlementEngine();

    @Test
    @DisplayName("new record is UNVERIFIED with tier NONE, zero caps and unscreened compliance")
    void unverifiedDefaults() {
        UserOnboarding user = UserOnboarding.unverified(" 0xAbC ", engine::entitlementsForTier, NOW);

        assertThat(user.getId()).isEqualTo("0xabc");
        assertThat(user.getWalletPrincipal()).isEqualTo("0xAbC");
        assertThat(user.getStatus()).isEqualTo(UserVerificationStatus.UNVERIFIED);
        assertThat(user.getTier()).isEqualTo(KycTier.NONE);
        assertThat(user.getEntitlements()).isEqualTo(engine.entitlementsForTier(KycTier.NONE));
        assertThat(user.getCompliance()).isEqualTo(ComplianceFlags.NOT_SCREENED);
        assertThat(user.getStatusHistory()).extracting(StatusChange::to).containsExactly("UNVERIFIED");
    }

    @Test
    @DisplayName("VERIFIED past expiresAt reads as EXPIRED without changing the stored status")
    void expiryIsDerived() {
        UserOnboarding user = verifiedUntil(NOW.plus(Duration.ofDays(365)));

        assertThat(user.isVerifiedAt(NOW)).isTrue();
        assertThat(user.effectiveStatus(NOW.plus(Duration.ofDays(366)))).isEqualTo(UserVerificationStatus.EXPIRED);
        assertThat(user.isVerifiedAt(NOW.plus(Duration.ofDays(366)))).isFalse();
        assertThat(user.getStatus()).isEqualTo(UserVerificationStatus.VERIFIED);
    }

    @Test
    @DisplayName("exactly at expiresAt the verification is still valid")
    void expiryBoundary() {
        Instant expiresAt = NOW.plus(Duration.ofDays(1));
        UserOnboarding user = verifiedUntil(expiresAt);

        assertThat(user.isVerifiedAt(expiresAt)).isTrue();
        assertThat(user.isVerifiedAt(expiresAt.plusMillis(1))).isFalse();
    }

    @Test
    @DisplayName("assignTier keeps tier and entitlements in step")
    void assignTier() {
        UserOnboarding user = UserOnboarding.unverified("0xabc", engine::entitlementsForTier, NOW);

        user.assignTier(KycTier.STANDARD, engine::entitlementsForTier);

        assertThat(user.getTier()).isEqualTo(KycTier.STANDARD);
        assertThat(user.getEntitlements()).isEqualTo(engine.entitlementsForTier(KycTier.STANDARD));
    }

    private UserOnboarding verifiedUntil(Instant expiresAt) {
        UserOnboarding user = UserOnboarding.unverified("0xabc", engine::entitlementsForTier, NOW);
        user.transitionTo(UserVerificationStatus.DOCUMENTS_SUBMITTED, NOW);
        user.transitionTo(UserVerificationStatus.VERIFICATION_IN_PROGRESS, NOW);
        user.transitionTo(UserVerificationStatus.VERIFIED, NOW);
        VerificationResult result = VerificationResult.builder()
                .success(true)
                .verdict(Verdict.VERIFIED)
                .verificationId("VRF-1")
                .verifiedBy(VerificationSource.MOCK_ORACLE)
                .timestamp(NOW)
                .build();
        user.setVerification(VerificationRecord.of(result, NOW, NOW, expiresAt));
        return user;
    }
}
