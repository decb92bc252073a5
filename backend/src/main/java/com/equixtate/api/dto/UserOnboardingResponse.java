package com.equixtate.api.dto;

import com.equixtate.domain.ComplianceFlags;
import com.equixtate.domain.Entitlements;
import com.equixtate.domain.PersonalInfo;
import com.equixtate.domain.StatusChange;
import com.equixtate.domain.UserDocuments;
import com.equixtate.domain.UserOnboarding;
import com.equixtate.domain.VerificationRecord;

import java.time.Instant;
import java.util.List;

/**
 * User record as served by the API. effectiveStatus reports EXPIRED for a lapsed verification while
 * status shows what is stored.
 */
public record UserOnboardingResponse(
        String walletPrincipal,
        String status,
        String effectiveStatus,
        String tier,
        Entitlements entitlements,
        ComplianceFlags compliance,
        PersonalInfo personalInfo,
        UserDocuments documents,
        VerificationRecord verification,
        List<StatusChange> statusHistory,
        Long version,
        Instant createdAt,
        Instant updatedAt
) {

    public static UserOnboardingResponse from(UserOnboarding u, Instant now) {
        return new UserOnboardingResponse(
                u.getWalletPrincipal(),
                u.getStatus() != null ? u.getStatus().name() : null,
                u.getStatus() != null ? u.effectiveStatus(now).name() : null,
                u.getTier() != null ? u.getTier().name() : null,
                u.getEntitlements(),
                u.getCompliance(),
                u.getPersonalInfo(),
                u.getDocuments(),
                u.getVerification(),
                u.getStatusHistory(),
                u.getVersion(),
                u.getCreatedAt(),
                u.getUpdatedAt());
    }
}
