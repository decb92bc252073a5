package com.equixtate.api.dto;

import com.equixtate.domain.VerificationResult;

/**
 * Outcome of POST .../verification and POST .../kyc: the oracle result and the status it led to.
 */
public record VerificationResponse(String recordId, String status, VerificationResult result) {
}
