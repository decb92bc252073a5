package com.equixtate.store;

import com.equixtate.domain.OnboardingRecord;

import java.util.List;
import java.util.Optional;

/**
 * Keyed, versioned storage for onboarding records.
 * <p>
 * {@link #upsert} never modifies its argument: it returns the persisted state with the next version
 * and a strictly later updatedAt. A null version means "insert"; an existing version must match the
 * stored one, otherwise {@link com.equixtate.common.OnboardingException} VERSION_CONFLICT is thrown.
 * Reads return detached copies.
 */
public interface OnboardingStore<T extends OnboardingRecord<T>> {

    Optional<T> get(String id);

    T upsert(T record);

    List<T> listAll();

    /** Records owned by the principal, matched case-insensitively. */
    List<T> findByPrincipal(String principal);
}
