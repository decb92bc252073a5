package com.equixtate.oracle;

import java.math.BigInteger;

/**
 * Decoded oracle verdict: (address, bool verified, uint256 timestamp, bytes32 attestationHash).
 */
public record VerdictPayload(String address, boolean verified, BigInteger timestamp, String attestationHash) {
}
