package com.equixtate.oracle;

/**
 * Wire request sent to the oracle endpoint.
 *
 * @param kernelId      oracle-side program to run (property and user checks use different kernels)
 * @param encodedParams 0x-prefixed ABI-style hex produced by {@link OracleParamsEncoder}
 */
public record OracleRequest(String senderPrincipal, String kernelId, String encodedParams) {
}
