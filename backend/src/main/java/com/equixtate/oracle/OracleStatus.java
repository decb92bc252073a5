package com.equixtate.oracle;

/**
 * Configuration report for the oracle integration, e.g. for an operator dashboard.
 */
public record OracleStatus(
        OracleMode mode,
        boolean hasEndpoint,
        boolean hasCredentials,
        boolean hasRegistryContract,
        boolean ready,
        String message
) {
}
