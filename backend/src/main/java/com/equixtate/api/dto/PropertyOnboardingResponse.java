package com.equixtate.api.dto;

import com.equixtate.domain.AdminNote;
import com.equixtate.domain.PropertyDocuments;
import com.equixtate.domain.PropertyFields;
import com.equixtate.domain.PropertyOnboarding;
import com.equixtate.domain.StatusChange;
import com.equixtate.domain.Tokenization;
import com.equixtate.domain.VerificationRecord;

import java.time.Instant;
import java.util.List;

public record PropertyOnboardingResponse(
        String id,
        String ownerPrincipal,
        String status,
        PropertyFields propertyFields,
        PropertyDocuments documents,
        VerificationRecord verification,
        Tokenization tokenization,
        List<AdminNote> adminNotes,
        List<StatusChange> statusHistory,
        Long version,
        Instant createdAt,
        Instant updatedAt
) {

    public static PropertyOnboardingResponse from(PropertyOnboarding p) {
        return new PropertyOnboardingResponse(
                p.getId(),
                p.getOwnerPrincipal(),
                p.getStatus() != null ? p.getStatus().name() : null,
                p.getPropertyFields(),
                p.getDocuments(),
                p.getVerification(),
                p.getTokenization(),
                p.getAdminNotes(),
                p.getStatusHistory(),
                p.getVersion(),
                p.getCreatedAt(),
                p.getUpdatedAt());
    }
}
