package com.equixtate.store;

import com.equixtate.common.OnboardingException;
import com.equixtate.domain.OnboardingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed store. Optimistic locking comes from the entity's {@code @Version} field:
 * a stale version surfaces as VERSION_CONFLICT, any other data access failure as STORAGE_ERROR.
 *
 * @param <T> mapped document type
 */
@Slf4j
public class MongoOnboardingStore<T extends OnboardingRecord<T>> implements OnboardingStore<T> {

    private final MongoTemplate mongoTemplate;
    private final Class<T> entityClass;
    /** Field holding the lower-cased principal ("ownerKey" for properties, "_id" for users). */
    private final String principalKeyField;
    private final Clock clock;

    public MongoOnboardingStore(MongoTemplate mongoTemplate, Class<T> entityClass, String principalKeyField,
                                Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.entityClass = entityClass;
        this.principalKeyField = principalKeyField;
        this.clock = clock;
    }

    @Override
    public Optional<T> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mongoTemplate.findById(id, entityClass));
        } catch (DataAccessException e) {
            throw OnboardingException.storage("Failed to read " + entityClass.getSimpleName() + " " + id, e);
        }
    }

    @Override
    public T upsert(T record) {
        T toSave = record.copy();
        toSave.setUpdatedAt(WriteStamps.next(record.getUpdatedAt(), clock));
        try {
            return mongoTemplate.save(toSave);
        } catch (OptimisticLockingFailureException | DuplicateKeyException e) {
            log.warn("Version conflict on {} {} (version {})", entityClass.getSimpleName(), record.getId(),
                    record.getVersion());
            throw OnboardingException.versionConflict(record.getId(), e);
        } catch (DataAccessException e) {
            throw OnboardingException.storage("Failed to write " + entityClass.getSimpleName() + " "
                    + record.getId(), e);
        }
    }

    @Override
    public List<T> listAll() {
        try {
            return mongoTemplate.find(new Query().with(Sort.by("_id")), entityClass);
        } catch (DataAccessException e) {
            throw OnboardingException.storage("Failed to list " + entityClass.getSimpleName(), e);
        }
    }

    @Override
    public List<T> findByPrincipal(String principal) {
        if (principal == null || principal.isBlank()) {
            return List.of();
        }
        Query query = new Query(where(principalKeyField).is(principal.trim().toLowerCase(Locale.ROOT)))
                .with(Sort.by("_id"));
        try {
            return mongoTemplate.find(query, entityClass);
        } catch (DataAccessException e) {
            throw OnboardingException.storage("Failed to query " + entityClass.getSimpleName()
                    + " by principal", e);
        }
    }
}
