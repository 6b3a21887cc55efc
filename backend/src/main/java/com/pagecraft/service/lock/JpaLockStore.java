package com.pagecraft.service.lock;

import com.pagecraft.domain.ResourceLockEntity;
import com.pagecraft.repository.ResourceLockRepository;
import io.micronaut.context.annotation.Requires;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link LockStore} backed by the {@code resource_locks} table.
 *
 * Inserts rely on the primary key to reject a second row; replace and delete
 * are single conditional statements on the token column.
 */
@Singleton
@Requires(property = "designer.locks.store", value = "jpa", defaultValue = "jpa")
public class JpaLockStore implements LockStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLockStore.class);

    private final ResourceLockRepository repository;

    public JpaLockStore(ResourceLockRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<ResourceLock> find(String resourceId) {
        return repository.findById(resourceId).map(JpaLockStore::toLock);
    }

    /** Not transactional itself: the key violation must surface from {@code save}. */
    @Override
    public boolean insertIfAbsent(ResourceLock lock) {
        if (repository.existsById(lock.resourceId())) {
            return false;
        }
        try {
            repository.save(toEntity(lock));
            return true;
        } catch (RuntimeException e) {
            if (repository.existsById(lock.resourceId())) {
                log.debug("Lost insert race on resource={}: {}", lock.resourceId(), e.getMessage());
                return false;
            }
            throw e;
        }
    }

    @Override
    @Transactional
    public boolean replace(String resourceId, String expectedToken, ResourceLock replacement) {
        return repository.replaceIfToken(resourceId, expectedToken,
            replacement.holderId(), replacement.token(), replacement.lockType().value(),
            replacement.acquiredAt(), replacement.expiresAt(), replacement.reason()) == 1;
    }

    @Override
    @Transactional
    public boolean delete(String resourceId, String expectedToken) {
        return repository.deleteIfToken(resourceId, expectedToken) == 1;
    }

    @Override
    public List<ResourceLock> findActive(Instant now, @Nullable String resourceId) {
        List<ResourceLockEntity> rows = resourceId == null
            ? repository.findActive(now)
            : repository.findActiveForResource(resourceId, now);
        return rows.stream().map(JpaLockStore::toLock).toList();
    }

    @Override
    @Transactional
    public int deleteExpired(Instant now) {
        return repository.deleteExpired(now);
    }

    private static ResourceLock toLock(ResourceLockEntity e) {
        return new ResourceLock(e.getResourceId(), e.getHolderId(), e.getToken(),
            LockType.of(e.getLockType()), e.getAcquiredAt(), e.getExpiresAt(), e.getReason());
    }

    private static ResourceLockEntity toEntity(ResourceLock lock) {
        ResourceLockEntity e = new ResourceLockEntity();
        e.setResourceId(lock.resourceId());
        e.setHolderId(lock.holderId());
        e.setToken(lock.token());
        e.setLockType(lock.lockType().value());
        e.setAcquiredAt(lock.acquiredAt());
        e.setExpiresAt(lock.expiresAt());
        e.setReason(lock.reason());
        return e;
    }
}
