package com.equixtate.onboarding.property;

/**
 * What the registry returns for a registered property.
 *
 * @param registryReference contract address or off-chain registry key
 */
public record TokenizationReceipt(String registryReference, String tokenId, String transactionHash) {
}
