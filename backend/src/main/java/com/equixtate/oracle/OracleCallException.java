package com.equixtate.oracle;

import lombok.Getter;

/**
 * Thrown when an oracle HTTP call fails. retryable distinguishes timeouts, connection failures,
 * 5xx and 429 from definitive failures such as 4xx.
 */
@Getter
public class OracleCallException extends RuntimeException {

    private final boolean retryable;

    public OracleCallException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }
}
