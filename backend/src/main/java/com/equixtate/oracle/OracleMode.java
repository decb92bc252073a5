package com.equixtate.oracle;

public enum OracleMode {
    LIVE,
    MOCK
}
