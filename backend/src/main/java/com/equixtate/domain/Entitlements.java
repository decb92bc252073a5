package com.equixtate.domain;

/**
 * Tier-derived permissions. Only ever produced by the entitlement engine.
 */
public record Entitlements(Cap maxInvestment, Cap maxPropertiesOwned, boolean canList, boolean canGovern) {
}
