package com.equixtate.domain;

import java.util.List;

/**
 * Fingerprinted property uploads. The deed is required at creation.
 */
public record PropertyDocuments(List<DocumentMetadata> images, List<DocumentMetadata> supportingDocs,
                                DocumentMetadata deed) {

    public PropertyDocuments {
        images = images == null ? List.of() : List.copyOf(images);
        supportingDocs = supportingDocs == null ? List.of() : List.copyOf(supportingDocs);
    }
}
