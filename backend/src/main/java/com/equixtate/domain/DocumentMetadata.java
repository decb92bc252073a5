package com.equixtate.domain;

import java.time.Instant;

/**
 * Fingerprinted upload. contentHash covers the raw bytes only, never the name or mime type.
 */
public record DocumentMetadata(
        String id,
        String displayName,
        String mimeType,
        long sizeBytes,
        String contentHash,
        DocumentKind kind,
        Instant uploadedAt
) {
}
