package com.equixtate.domain;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Structured listing fields collected by the submission form. price is in USD.
 */
@Builder
public record PropertyFields(
        String name,
        String propertyType,
        String location,
        String description,
        BigDecimal price,
        Integer bedrooms,
        Integer bathrooms,
        Integer squareFootage,
        ListingType listingType
) {
}
