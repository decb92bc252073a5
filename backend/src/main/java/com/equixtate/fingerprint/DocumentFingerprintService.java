package com.equixtate.fingerprint;

import com.equixtate.common.ContentHash;
import com.equixtate.common.OnboardingException;
import com.equixtate.common.PrefixedIds;
import com.equixtate.domain.DocumentKind;
import com.equixtate.domain.DocumentMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Hashes uploaded documents into immutable metadata. The hash covers the raw bytes only, so identical
 * content fingerprints identically whatever it is named. Stateless and safe to call concurrently.
 */
@Service
@RequiredArgsConstructor
public class DocumentFingerprintService {

    static final String UNNAMED = "unnamed";
    static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final Clock clock;

    /**
     * @throws OnboardingException VALIDATION / EMPTY_DOCUMENT when bytes are null or empty
     */
    public DocumentMetadata fingerprint(byte[] bytes, String name, String mimeType, DocumentKind kind) {
        if (bytes == null || bytes.length == 0) {
            throw OnboardingException.validation(OnboardingException.EMPTY_DOCUMENT,
                    "Document " + (name != null ? name : UNNAMED) + " is empty");
        }
        return new DocumentMetadata(
                PrefixedIds.next(PrefixedIds.FILE, clock),
                name == null || name.isBlank() ? UNNAMED : name.strip(),
                mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType.strip(),
                bytes.length,
                ContentHash.of(bytes),
                kind,
                clock.instant());
    }

    public DocumentMetadata fingerprint(byte[] bytes, String name, String mimeType) {
        return fingerprint(bytes, name, mimeType, null);
    }

    public DocumentMetadata fingerprint(DocumentUpload upload, DocumentKind kind) {
        return fingerprint(upload.content(), upload.name(), upload.mimeType(), kind);
    }

    public List<DocumentMetadata> fingerprintAll(List<DocumentUpload> uploads, DocumentKind kind) {
        if (uploads == null) {
            return List.of();
        }
        return uploads.stream().map(u -> fingerprint(u, kind)).toList();
    }
}
