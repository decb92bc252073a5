package com.equixtate.domain;

/**
 * What a verification request is about.
 */
public enum SubjectKind {
    PROPERTY,
    USER
}
