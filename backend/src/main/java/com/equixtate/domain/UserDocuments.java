package com.equixtate.domain;

public record UserDocuments(IdentityDocumentType identityType, DocumentMetadata identity,
                            DocumentMetadata addressProof) {

    public static final UserDocuments EMPTY = new UserDocuments(null, null, null);
}
