package com.equixtate.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Listing details written once a verified property reaches LISTED.
 */
public record Tokenization(
        String registryReference,
        String tokenId,
        BigInteger totalTokens,
        BigDecimal tokenUnitPrice,
        String transactionHash,
        Instant listedAt
) {
}
