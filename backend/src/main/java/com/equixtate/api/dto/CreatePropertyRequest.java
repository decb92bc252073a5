package com.equixtate.api.dto;

import com.equixtate.api.validation.WalletAddress;
import com.equixtate.domain.ListingType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.List;

/**
 * POST /api/v1/properties request body. Validated with Jakarta Bean Validation.
 */
public record CreatePropertyRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @WalletAddress
        String ownerPrincipal,

        @NotBlank(message = "INVALID_FIELDS")
        String name,

        String propertyType,

        @NotBlank(message = "INVALID_FIELDS")
        String location,

        String description,

        @NotNull(message = "INVALID_FIELDS")
        @Positive(message = "INVALID_FIELDS")
        BigDecimal price,

        Integer bedrooms,
        Integer bathrooms,
        Integer squareFootage,
        ListingType listingType,

        @NotNull(message = "INVALID_FIELDS")
        @Valid
        DocumentPayload deed,

        List<DocumentPayload> images,
        List<DocumentPayload> supportingDocs
) {
}
