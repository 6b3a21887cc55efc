package com.pagecraft.service.lock;

import io.micronaut.core.annotation.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for lock records, at most one per resource.
 *
 * Every write is conditional. {@link #insertIfAbsent} fails when any record
 * exists for the resource; {@link #replace} and {@link #delete} fail unless
 * the stored token still equals {@code expectedToken}. A {@code false} result
 * means another writer got there first; the caller decides what to report.
 */
public interface LockStore {

    Optional<ResourceLock> find(String resourceId);

    boolean insertIfAbsent(ResourceLock lock);

    boolean replace(String resourceId, String expectedToken, ResourceLock replacement);

    boolean delete(String resourceId, String expectedToken);

    /** Records with {@code expiresAt > now}, optionally for one resource. */
    List<ResourceLock> findActive(Instant now, @Nullable String resourceId);

    /** Removes records with {@code expiresAt <= now}; returns how many went. */
    int deleteExpired(Instant now);
}
