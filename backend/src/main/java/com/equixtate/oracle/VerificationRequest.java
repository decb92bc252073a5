package com.equixtate.oracle;

import com.equixtate.domain.SubjectKind;

import java.util.List;

/**
 * Parameter object for one verification attempt. Built fresh per attempt and never persisted.
 */
public record VerificationRequest(
        String subjectId,
        SubjectKind subjectKind,
        String ownerPrincipal,
        List<String> documentHashes,
        SubjectFields structuredFields
) {

    public VerificationRequest {
        documentHashes = documentHashes == null ? List.of() : List.copyOf(documentHashes);
    }
}
