package com.equixtate.domain;

/**
 * Role of an uploaded document within its onboarding record.
 */
public enum DocumentKind {
    PROPERTY_DEED,
    TAX_RECORD,
    PROPERTY_IMAGE,
    IDENTITY_DOCUMENT,
    PROOF_OF_ADDRESS
}
