package com.equixtate.oracle;

import java.util.Map;

/**
 * Wire response from the oracle endpoint. verdictPayload is decoded by {@link VerdictPayloadDecoder}.
 */
public record OracleResponse(String auth, String verdictPayload, Map<String, Object> params) {
}
