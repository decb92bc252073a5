package com.equixtate.oracle.config;

import com.equixtate.oracle.AttestationOracle;
import com.equixtate.oracle.LiveAttestationOracle;
import com.equixtate.oracle.MockAttestationOracle;
import com.equixtate.oracle.OracleClient;
import com.equixtate.oracle.OracleMode;
import com.equixtate.oracle.WebClientOracleClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the oracle adapter. Live or mock is decided once, here, from the completeness of
 * equixtate.oracle.*; the choice never changes for the lifetime of the context.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OracleProperties.class)
public class OracleConfig {

    @Bean(name = "oracleRateLimiter")
    public RateLimiter oracleRateLimiter(OracleProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("attestation-oracle", config);
    }

    @Bean
    public OracleClient oracleClient(WebClient.Builder webClientBuilder, OracleProperties properties) {
        return new WebClientOracleClient(webClientBuilder, properties.getEndpointUrl(), properties.getEntryId(),
                properties.getAccessToken(), properties.getRegistryContract());
    }

    @Bean
    public AttestationOracle attestationOracle(OracleProperties properties,
                                               OracleClient oracleClient,
                                               @Qualifier("oracleRateLimiter") RateLimiter oracleRateLimiter,
                                               Clock clock) {
        return selectOracle(properties, oracleClient, oracleRateLimiter, clock);
    }

    static AttestationOracle selectOracle(OracleProperties properties, OracleClient client, RateLimiter limiter,
                                          Clock clock) {
        if (properties.isComplete()) {
            log.info("Attestation oracle: LIVE (endpoint {}, property kernel {}, user kernel {})",
                    properties.getEndpointUrl(), properties.getPropertyKernelId(), properties.getUserKernelId());
            return new LiveAttestationOracle(client, properties, limiter, clock);
        }
        log.warn("Attestation oracle: MOCK. {}", properties.status(OracleMode.MOCK).message());
        return new MockAttestationOracle(clock, properties);
    }
}
