package com.equixtate.onboarding.user;

import com.equixtate.domain.IdentityDocumentType;
import com.equixtate.domain.KycTier;
import com.equixtate.domain.PersonalInfo;
import com.equixtate.fingerprint.DocumentUpload;

/**
 * KYC submission for one wallet principal.
 *
 * @param targetTier tier granted on a VERIFIED verdict; null or NONE requests BASIC
 */
public record KycSubmission(
        String principal,
        PersonalInfo personalInfo,
        IdentityDocumentType identityType,
        DocumentUpload identity,
        DocumentUpload addressProof,
        KycTier targetTier
) {

    public KycTier effectiveTargetTier() {
        return targetTier == null || targetTier == KycTier.NONE ? KycTier.BASIC : targetTier;
    }
}
