package com.equixtate.oracle;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Oracle client over HTTP using WebClient. Credentials travel as headers on every request.
 */
public class WebClientOracleClient implements OracleClient {

    static final String ENTRY_ID_HEADER = "X-Entry-Id";
    static final String ACCESS_TOKEN_HEADER = "X-Access-Token";
    static final String REGISTRY_CONTRACT_HEADER = "X-Registry-Contract";

    private final WebClient webClient;
    private final String endpointUrl;

    public WebClientOracleClient(WebClient.Builder builder, String endpointUrl, String entryId, String accessToken,
                                 String registryContract) {
        this.endpointUrl = endpointUrl;
        this.webClient = builder
                .defaultHeaders(headers -> {
                    putIfPresent(headers, ENTRY_ID_HEADER, entryId);
                    putIfPresent(headers, ACCESS_TOKEN_HEADER, accessToken);
                    putIfPresent(headers, REGISTRY_CONTRACT_HEADER, registryContract);
                })
                .build();
    }

    @Override
    public Mono<OracleResponse> execute(OracleRequest request) {
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(OracleResponse.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new OracleCallException("Oracle responded " + e.getStatusCode().value() + ": "
                                + e.getMessage(), e, isRetryable(e.getStatusCode())))
                .onErrorMap(WebClientRequestException.class,
                        e -> new OracleCallException("Oracle unreachable: " + e.getMessage(), e, true));
    }

    private static void putIfPresent(HttpHeaders headers, String name, String value) {
        if (value != null && !value.isBlank()) {
            headers.set(name, value);
        }
    }

    static boolean isRetryable(HttpStatusCode status) {
        return status.is5xxServerError() || status.value() == 429;
    }
}
