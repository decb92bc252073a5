package com.equixtate.api.dto;

import com.equixtate.domain.IdentityDocumentType;
import com.equixtate.domain.KycTier;

/**
 * POST /api/v1/users/{principal}/kyc request body. Completeness is checked by the workflow so a
 * partial submission reports INCOMPLETE_SUBMISSION with every missing part.
 */
public record KycRequest(
        String fullName,
        String email,
        String country,
        String dateOfBirth,
        String nationality,
        IdentityDocumentType identityType,
        DocumentPayload identityDocument,
        DocumentPayload addressProof,
        KycTier targetTier
) {
}
