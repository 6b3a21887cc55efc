package com.pagecraft.repository;

import com.pagecraft.domain.ResourceLockEntity;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.data.annotation.Query;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ResourceLockRepository extends JpaRepository<ResourceLockEntity, String> {

    /**
     * Overwrites the record only while it still carries {@code expectedToken}.
     * Returns 0 when another writer replaced or removed it first.
     */
    @Query("UPDATE ResourceLockEntity l SET l.holderId = :holderId, l.token = :newToken, " +
           "l.lockType = :lockType, l.acquiredAt = :acquiredAt, l.expiresAt = :expiresAt, " +
           "l.reason = :reason " +
           "WHERE l.resourceId = :resourceId AND l.token = :expectedToken")
    int replaceIfToken(String resourceId, String expectedToken, String holderId, String newToken,
                       String lockType, Instant acquiredAt, Instant expiresAt, @Nullable String reason);

    @Query("DELETE FROM ResourceLockEntity l WHERE l.resourceId = :resourceId AND l.token = :expectedToken")
    int deleteIfToken(String resourceId, String expectedToken);

    @Query("FROM ResourceLockEntity l WHERE l.expiresAt > :now ORDER BY l.resourceId")
    List<ResourceLockEntity> findActive(Instant now);

    @Query("FROM ResourceLockEntity l WHERE l.resourceId = :resourceId AND l.expiresAt > :now")
    List<ResourceLockEntity> findActiveForResource(String resourceId, Instant now);

    /**
     * Delete locks that have passed their expiry; called by the scheduled expiry sweep.
     */
    @Query("DELETE FROM ResourceLockEntity l WHERE l.expiresAt <= :now")
    int deleteExpired(Instant now);
}
