package com.equixtate.domain;

public enum ListingType {
    SALE,
    AUCTION,
    RENT
}
