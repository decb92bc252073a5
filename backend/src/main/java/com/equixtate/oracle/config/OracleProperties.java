package com.equixtate.oracle.config;

import com.equixtate.oracle.OracleMode;
import com.equixtate.oracle.OracleStatus;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Attestation oracle endpoint, credentials and call budget. The live oracle is used only when
 * endpoint, credential pair and registry contract are all present.
 */
@ConfigurationProperties(prefix = "equixtate.oracle")
@NoArgsConstructor
@Getter
@Setter
public class OracleProperties {

    /** Oracle HTTP endpoint (POST). */
    private String endpointUrl;

    /** Entry id half of the credential pair. */
    private String entryId;

    /** Access token half of the credential pair. */
    private String accessToken;

    /** Address of the on-chain registry contract the oracle attests against. */
    private String registryContract;

    /** Kernel (oracle-side program) id for property verification. */
    private String propertyKernelId = "1529";

    /** Kernel id for user identity verification. */
    private String userKernelId = "337";

    /** Upper bound for one oracle round trip; exceeding it is a retryable failure. */
    private Duration timeout = Duration.ofSeconds(20);

    /** Outbound oracle budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 5;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 500;

    public boolean hasEndpoint() {
        return isPresent(endpointUrl);
    }

    public boolean hasCredentials() {
        return isPresent(entryId) && isPresent(accessToken);
    }

    public boolean hasRegistryContract() {
        return isPresent(registryContract);
    }

    public boolean isComplete() {
        return hasEndpoint() && hasCredentials() && hasRegistryContract();
    }

    /** Configuration report for the given active mode; the message names every missing setting. */
    public OracleStatus status(OracleMode mode) {
        List<String> missing = new ArrayList<>();
        if (!hasEndpoint()) {
            missing.add("endpoint-url");
        }
        if (!isPresent(entryId)) {
            missing.add("entry-id");
        }
        if (!isPresent(accessToken)) {
            missing.add("access-token");
        }
        if (!hasRegistryContract()) {
            missing.add("registry-contract");
        }
        boolean ready = missing.isEmpty();
        String message;
        if (mode == OracleMode.LIVE) {
            message = "Live oracle configured";
        } else if (ready) {
            message = "Oracle configured but mock mode is active";
        } else {
            message = "Mock mode: missing equixtate.oracle." + String.join(", equixtate.oracle.", missing);
        }
        return new OracleStatus(mode, hasEndpoint(), hasCredentials(), hasRegistryContract(), ready, message);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
