package com.equixtate.onboarding.property;

/**
 * Registers a verified property with the token registry (on-chain contract or an off-chain fallback).
 * Implementations throw any RuntimeException on failure; the workflow rolls the record back.
 */
public interface TokenRegistry {

    TokenizationReceipt register(TokenizationRequest request);
}
