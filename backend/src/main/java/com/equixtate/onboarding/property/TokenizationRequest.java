package com.equixtate.onboarding.property;

import java.math.BigDecimal;
import java.math.BigInteger;

public record TokenizationRequest(
        String propertyId,
        String ownerPrincipal,
        String name,
        String location,
        BigDecimal declaredValue,
        String deedHash,
        BigInteger totalTokens
) {
}
