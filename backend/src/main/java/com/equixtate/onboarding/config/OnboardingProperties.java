package com.equixtate.onboarding.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Workflow settings: token economics, KYC validity, crash recovery and storage backend.
 */
@ConfigurationProperties(prefix = "equixtate.onboarding")
@NoArgsConstructor
@Getter
@Setter
public class OnboardingProperties {

    /** USD price of one property token; totalTokens = floor(price / tokenUnitPrice). */
    private BigDecimal tokenUnitPrice = BigDecimal.TEN;

    /** How long a successful KYC verification stays valid. */
    private Duration kycValidity = Duration.ofDays(365);

    /**
     * Age after which a VERIFICATION_IN_PROGRESS claim left by a crashed process may be resubmitted.
     * Should exceed the oracle timeout; defaults to twice the 20s default.
     */
    private Duration staleClaimAfter = Duration.ofSeconds(40);

    /** Storage backend: mongo or memory. */
    private StoreType store = StoreType.MONGO;

    public enum StoreType {
        MONGO,
        MEMORY
    }
}
