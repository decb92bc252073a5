package com.equixtate.api.dto;

import com.equixtate.common.OnboardingException;
import com.equixtate.fingerprint.DocumentUpload;

import java.util.Base64;
import java.util.List;

/**
 * Uploaded file inside a JSON request; content is base64.
 */
public record DocumentPayload(String name, String mimeType, String contentBase64) {

    /**
     * @throws OnboardingException VALIDATION / INVALID_FIELDS when content is not valid base64
     */
    public DocumentUpload toUpload() {
        byte[] content;
        try {
            content = contentBase64 == null ? new byte[0] : Base64.getDecoder().decode(contentBase64.strip());
        } catch (IllegalArgumentException e) {
            throw OnboardingException.validation(OnboardingException.INVALID_FIELDS,
                    "Document " + name + " is not valid base64");
        }
        return new DocumentUpload(name, mimeType, content);
    }

    public static DocumentUpload toUploadOrNull(DocumentPayload payload) {
        return payload == null ? null : payload.toUpload();
    }

    public static List<DocumentUpload> toUploads(List<DocumentPayload> payloads) {
        return payloads == null ? List.of() : payloads.stream().map(DocumentPayload::toUpload).toList();
    }
}
