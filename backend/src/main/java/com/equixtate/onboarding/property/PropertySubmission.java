package com.equixtate.onboarding.property;

import com.equixtate.domain.PropertyFields;
import com.equixtate.fingerprint.DocumentUpload;

import java.util.List;

/**
 * Everything an owner submits to list a property: structured fields plus raw uploads.
 */
public record PropertySubmission(
        String ownerPrincipal,
        PropertyFields fields,
        DocumentUpload deed,
        List<DocumentUpload> images,
        List<DocumentUpload> supportingDocs
) {

    public PropertySubmission {
        images = images == null ? List.of() : List.copyOf(images);
        supportingDocs = supportingDocs == null ? List.of() : List.copyOf(supportingDocs);
    }
}
