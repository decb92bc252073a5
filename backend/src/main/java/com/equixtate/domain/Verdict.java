package com.equixtate.domain;

/**
 * Oracle judgment on a verification request. NEEDS_REVIEW routes to a human reviewer;
 * only an explicit oracle rejection or a failed call yields REJECTED.
 */
public enum Verdict {
    VERIFIED,
    REJECTED,
    NEEDS_REVIEW
}
