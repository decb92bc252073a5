package com.equixtate.oracle;

import java.math.BigDecimal;

/**
 * Structured fields the oracle matches against external records.
 *
 * @param location      property location, or the user's country
 * @param declaredValue property value in USD; null for users
 * @param propertyType  null for users
 */
public record SubjectFields(String name, String location, BigDecimal declaredValue, String propertyType) {
}
