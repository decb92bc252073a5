package com.equixtate.oracle;

import reactor.core.publisher.Mono;

/**
 * Transport to the external oracle, kept behind an interface for testing.
 * Timeouts are applied by the caller.
 */
public interface OracleClient {

    /**
     * Submit one request.
     *
     * @return decoded response; errors with {@link OracleCallException} on HTTP or connection failure
     */
    Mono<OracleResponse> execute(OracleRequest request);
}
