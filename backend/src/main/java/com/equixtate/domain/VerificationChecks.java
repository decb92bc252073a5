package com.equixtate.domain;

/**
 * Outcome of the three oracle gates. crossAttested=false on every mock result.
 */
public record VerificationChecks(boolean documentAuthenticity, boolean recordMatch, boolean crossAttested) {

    public static final VerificationChecks NONE = new VerificationChecks(false, false, false);
}
