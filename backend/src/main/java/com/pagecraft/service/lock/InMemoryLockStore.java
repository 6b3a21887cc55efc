package com.pagecraft.service.lock;

import io.micronaut.context.annotation.Requires;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-process {@link LockStore}. Each conditional write runs inside one
 * atomic map operation on the resource's entry.
 */
@Singleton
@Requires(property = "designer.locks.store", value = "memory")
public class InMemoryLockStore implements LockStore {

    private final ConcurrentMap<String, ResourceLock> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<ResourceLock> find(String resourceId) {
        return Optional.ofNullable(locks.get(resourceId));
    }

    @Override
    public boolean insertIfAbsent(ResourceLock lock) {
        return locks.putIfAbsent(lock.resourceId(), lock) == null;
    }

    @Override
    public boolean replace(String resourceId, String expectedToken, ResourceLock replacement) {
        boolean[] swapped = {false};
        locks.computeIfPresent(resourceId, (id, current) -> {
            if (!current.token().equals(expectedToken)) {
                return current;
            }
            swapped[0] = true;
            return replacement;
        });
        return swapped[0];
    }

    @Override
    public boolean delete(String resourceId, String expectedToken) {
        boolean[] removed = {false};
        locks.computeIfPresent(resourceId, (id, current) -> {
            if (!current.token().equals(expectedToken)) {
                return current;
            }
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    @Override
    public List<ResourceLock> findActive(Instant now, @Nullable String resourceId) {
        return locks.values().stream()
            .filter(l -> l.isValidAt(now))
            .filter(l -> resourceId == null || l.resourceId().equals(resourceId))
            .sorted(Comparator.comparing(ResourceLock::resourceId))
            .toList();
    }

    @Override
    public int deleteExpired(Instant now) {
        int[] removed = {0};
        for (String resourceId : locks.keySet()) {
            locks.computeIfPresent(resourceId, (id, current) -> {
                if (current.isValidAt(now)) {
                    return current;
                }
                removed[0]++;
                return null;
            });
        }
        return removed[0];
    }
}
