package com.equixtate.oracle;

import com.equixtate.common.ErrorKind;
import com.equixtate.common.OnboardingException;
import com.equixtate.domain.SubjectKind;
import com.equixtate.domain.Verdict;
import com.equixtate.domain.VerificationResult;
import com.equixtate.domain.VerificationSource;
import com.equixtate.oracle.config.OracleProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LiveAttestationOracleTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String OWNER = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e";
    private static final String HASH = "0x" + "ab".repeat(32);

    @Mock
    OracleClient client;
    @Mock
    RateLimiter rateLimiter;

    private OracleProperties properties;
    private LiveAttestationOracle oracle;

    @BeforeEach
    void setUp() {
        properties = new OracleProperties();
        properties.setEndpointUrl("https://oracle.test/execute");
        properties.setEntryId("entry");
        properties.setAccessToken("token");
        properties.setRegistryContract("0x0000000000000000000000000000000000000001");
        properties.setTimeout(Duration.ofMillis(200));
        oracle = new LiveAttestationOracle(client, properties, rateLimiter, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static VerificationRequest propertyRequest(List<String> hashes, String name, BigDecimal value) {
        return new VerificationRequest("PROP-1", SubjectKind.PROPERTY, OWNER, hashes,
                new SubjectFields(name, "Accra", value, "villa"));
    }

    private static OracleResponse response(boolean verified) {
        return new OracleResponse("sig", VerdictPayloadDecoderTest.payload(verified, NOW.getEpochSecond()), Map.of());
    }

    @Test
    @DisplayName("verified verdict gives VERIFIED, cross-attested, with the payload attestation hash")
    void verified() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(client.execute(any())).thenReturn(Mono.just(response(true)));

        VerificationResult result = oracle.verifyProperty(propertyRequest(List.of(HASH), "Villa",
                new BigDecimal("100000")));

        assertThat(result.verdict()).isEqualTo(Verdict.VERIFIED);
        assertThat(result.success()).isTrue();
        assertThat(result.checks().crossAttested()).isTrue();
        assertThat(result.attestationHash()).isEqualTo("0x" + VerdictPayloadDecoderTest.HASH_WORD);
        assertThat(result.verifiedBy()).isEqualTo(VerificationSource.LIVE_ORACLE);

        ArgumentCaptor<OracleRequest> captor = ArgumentCaptor.forClass(OracleRequest.class);
        verify(client).execute(captor.capture());
        assertThat(captor.getValue().kernelId()).isEqualTo("1529");
        assertThat(captor.getValue().senderPrincipal()).isEqualTo(OWNER);
        assertThat(captor.getValue().encodedParams()).startsWith("0x").hasSize(2 + 5 * 64);
    }

    @Test
    @DisplayName("user verification targets the user kernel")
    void userKernel() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(client.execute(any())).thenReturn(Mono.just(response(true)));

        oracle.verifyUser(new VerificationRequest(OWNER.toLowerCase(), SubjectKind.USER, OWNER, List.of(HASH, HASH),
                new SubjectFields("Ama Mensah", "GH", null, null)));

        ArgumentCaptor<OracleRequest> captor = ArgumentCaptor.forClass(OracleRequest.class);
        verify(client).execute(captor.capture());
        assertThat(captor.getValue().kernelId()).isEqualTo("337");
    }

    @Test
    @DisplayName("verified=false gives REJECTED")
    void explicitRejection() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(client.execute(any())).thenReturn(Mono.just(response(false)));

        VerificationResult result = oracle.verifyProperty(propertyRequest(List.of(HASH), "Villa", BigDecimal.TEN));

        assertThat(result.verdict()).isEqualTo(Verdict.REJECTED);
        assertThat(result.success()).isFalse();
        assertThat(result.errors()).isNotEmpty();
    }

    @Test
    @DisplayName("malformed document hash gives NEEDS_REVIEW without a network call")
    void authenticityGate() {
        VerificationResult result = oracle.verifyProperty(propertyRequest(List.of("0xNOTAHASH"), "Villa",
                BigDecimal.TEN));

        assertThat(result.verdict()).isEqualTo(Verdict.NEEDS_REVIEW);
        assertThat(result.checks().documentAuthenticity()).isFalse();
        verify(client, never()).execute(any());
    }

    @Test
    @DisplayName("no documents gives NEEDS_REVIEW without a network call")
    void noDocuments() {
        VerificationResult result = oracle.verifyProperty(propertyRequest(List.of(), "Villa", BigDecimal.TEN));

        assertThat(result.verdict()).isEqualTo(Verdict.NEEDS_REVIEW);
        verify(client, never()).execute(any());
    }

    @Test
    @DisplayName("blank name or non-positive value fails the record-match gate")
    void recordMatchGate() {
        VerificationResult blankName = oracle.verifyProperty(propertyRequest(List.of(HASH), " ", BigDecimal.TEN));
        VerificationResult zeroValue = oracle.verifyProperty(propertyRequest(List.of(HASH), "Villa", BigDecimal.ZERO));

        assertThat(blankName.verdict()).isEqualTo(Verdict.NEEDS_REVIEW);
        assertThat(blankName.checks().documentAuthenticity()).isTrue();
        assertThat(blankName.checks().recordMatch()).isFalse();
        assertThat(zeroValue.verdict()).isEqualTo(Verdict.NEEDS_REVIEW);
        verify(client, never()).execute(any());
    }

    @Test
    @DisplayName("timeout is retryable and surfaces as ORACLE_UNAVAILABLE")
    void timeout() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(client.execute(any())).thenReturn(Mono.never());

        assertThatThrownBy(() -> oracle.verifyProperty(propertyRequest(List.of(HASH), "Villa", BigDecimal.TEN)))
                .isInstanceOf(OnboardingException.class)
                .satisfies(e -> {
                    assertThat(((OnboardingException) e).getKind()).isEqualTo(ErrorKind.ORACLE_UNAVAILABLE);
                    assertThat(((OnboardingException) e).isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("retryable transport failure surfaces as ORACLE_UNAVAILABLE")
    void retryableFailure() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(client.execute(any())).thenReturn(Mono.error(new OracleCallException("503", null, true)));

        assertThatThrownBy(() -> oracle.verifyProperty(propertyRequest(List.of(HASH), "Villa", BigDecimal.TEN)))
                .isInstanceOf(OnboardingException.class)
                .satisfies(e -> assertThat(((OnboardingException) e).getErrorCode())
                        .isEqualTo(OnboardingException.ORACLE_UNAVAILABLE));
    }

    @Test
    @DisplayName("non-retryable failure becomes a REJECTED result")
    void nonRetryableFailure() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(client.execute(any())).thenReturn(Mono.error(new OracleCallException("Oracle responded 400", null, false)));

        VerificationResult result = oracle.verifyProperty(propertyRequest(List.of(HASH), "Villa", BigDecimal.TEN));

        assertThat(result.verdict()).isEqualTo(Verdict.REJECTED);
        assertThat(result.errors()).anySatisfy(err -> assertThat(err).contains("400"));
    }

    @Test
    @DisplayName("malformed verdict payload becomes a REJECTED result")
    void malformedPayload() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(client.execute(any())).thenReturn(Mono.just(new OracleResponse("sig", "0xdead", Map.of())));

        VerificationResult result = oracle.verifyProperty(propertyRequest(List.of(HASH), "Villa", BigDecimal.TEN));

        assertThat(result.verdict()).isEqualTo(Verdict.REJECTED);
    }

    @Test
    @DisplayName("owner that is not an address cannot be encoded and is rejected without a call")
    void unencodableOwner() {
        VerificationResult result = oracle.verifyProperty(new VerificationRequest("PROP-1", SubjectKind.PROPERTY,
                "alice", List.of(HASH), new SubjectFields("Villa", "Accra", BigDecimal.TEN, null)));

        assertThat(result.verdict()).isEqualTo(Verdict.REJECTED);
        verify(client, never()).execute(any());
    }

    @Test
    @DisplayName("limiter refusal is retryable")
    void limiterRefusal() {
        when(rateLimiter.acquirePermission()).thenReturn(false);

        assertThatThrownBy(() -> oracle.verifyProperty(propertyRequest(List.of(HASH), "Villa", BigDecimal.TEN)))
                .isInstanceOf(OnboardingException.class)
                .satisfies(e -> assertThat(((OnboardingException) e).getKind()).isEqualTo(ErrorKind.ORACLE_UNAVAILABLE));
        verify(client, never()).execute(any());
    }
}
