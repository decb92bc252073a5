package com.equixtate.onboarding;

import com.equixtate.domain.SubjectKind;

import java.time.Instant;

/**
 * Application event: a persisted onboarding record changed status.
 * Published by the workflows after the write succeeds.
 *
 * @param from previous status name, null for a new record
 */
public record OnboardingStatusChangedEvent(SubjectKind subjectKind, String recordId, String from, String to,
                                           Long version, Instant at) {
}
