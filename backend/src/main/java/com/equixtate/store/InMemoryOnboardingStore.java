package com.equixtate.store;

import com.equixtate.common.OnboardingException;
import com.equixtate.domain.OnboardingRecord;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for tests and single-node demos (equixtate.onboarding.store=memory).
 * Version checks are done atomically per key with {@link ConcurrentHashMap#compute}.
 */
public class InMemoryOnboardingStore<T extends OnboardingRecord<T>> implements OnboardingStore<T> {

    private final Map<String, T> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryOnboardingStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<T> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(id)).map(OnboardingRecord::copy);
    }

    @Override
    public T upsert(T record) {
        Objects.requireNonNull(record.getId(), "record id");
        T toSave = record.copy();
        T saved = records.compute(record.getId(), (id, existing) -> {
            if (record.getVersion() == null) {
                if (existing != null) {
                    throw OnboardingException.versionConflict(id, null);
                }
                toSave.setVersion(0L);
            } else {
                if (existing == null || !record.getVersion().equals(existing.getVersion())) {
                    throw OnboardingException.versionConflict(id, null);
                }
                toSave.setVersion(record.getVersion() + 1);
            }
            toSave.setUpdatedAt(WriteStamps.next(existing == null ? record.getUpdatedAt() : existing.getUpdatedAt(),
                    clock));
            return toSave;
        });
        return saved.copy();
    }

    @Override
    public List<T> listAll() {
        return records.values().stream()
                .map(OnboardingRecord::copy)
                .sorted(Comparator.comparing(OnboardingRecord::getId))
                .toList();
    }

    @Override
    public List<T> findByPrincipal(String principal) {
        if (principal == null || principal.isBlank()) {
            return List.of();
        }
        String key = principal.trim().toLowerCase(Locale.ROOT);
        return listAll().stream()
                .filter(r -> r.getPrincipal() != null && key.equals(r.getPrincipal().toLowerCase(Locale.ROOT)))
                .toList();
    }
}
