package com.equixtate.domain;

import java.time.Instant;

/**
 * Common shape of the persisted onboarding records, as seen by the stores.
 * version is the optimistic-lock counter (null until first insert); updatedAt strictly increases per write.
 */
public interface OnboardingRecord<T extends OnboardingRecord<T>> {

    String getId();

    /** Owning principal as submitted (wallet address). */
    String getPrincipal();

    Long getVersion();

    void setVersion(Long version);

    Instant getUpdatedAt();

    void setUpdatedAt(Instant updatedAt);

    /** Copy detached from this instance; mutable collections are duplicated. */
    T copy();
}
