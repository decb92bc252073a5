package com.equixtate.domain;

public enum IdentityDocumentType {
    PASSPORT,
    NATIONAL_ID,
    DRIVERS_LICENSE
}
