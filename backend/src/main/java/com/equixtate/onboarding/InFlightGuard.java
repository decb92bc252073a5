package com.equixtate.onboarding;

import com.equixtate.common.OnboardingException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one verification or tokenization in flight per record id within this process.
 * Cross-process races are caught by the store's version check instead.
 */
public class InFlightGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @throws OnboardingException VALIDATION / INVALID_FIELDS for a blank id;
     *                             CONCURRENCY_CONFLICT / VERIFICATION_ALREADY_IN_PROGRESS if id is held
     */
    public void acquire(String id) {
        if (id == null || id.isBlank()) {
            throw OnboardingException.validation(OnboardingException.INVALID_FIELDS, "Record id is required");
        }
        if (!inFlight.add(id)) {
            throw OnboardingException.alreadyInProgress(id);
        }
    }

    public void release(String id) {
        inFlight.remove(id);
    }
}
