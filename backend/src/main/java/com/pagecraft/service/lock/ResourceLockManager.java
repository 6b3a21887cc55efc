package com.pagecraft.service.lock;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Grants, extends and revokes time-bounded exclusive locks on opaque resource ids.
 *
 * At most one valid lock exists per resource. Every write goes through the
 * conditional operations of {@link LockStore}, so two managers racing over
 * the same store cannot both win. A lost race is reported to the caller as a
 * failure and never retried here.
 *
 * Expiry is passive: an expired record keeps its row until the next acquire
 * reclaims it or {@link #cleanupExpired()} sweeps it.
 */
@Singleton
public class ResourceLockManager {

    private static final Logger log = LoggerFactory.getLogger(ResourceLockManager.class);

    private final LockStore store;
    private final LockConfiguration config;
    private final Clock clock;

    public ResourceLockManager(LockStore store, LockConfiguration config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Grants {@code resourceId} to {@code holderId}.
     *
     * <ul>
     *   <li>no record: a new lock is stored</li>
     *   <li>expired record: reclaimed and replaced by a new lock</li>
     *   <li>valid record of the same holder: refreshed in place, keeping its token</li>
     *   <li>valid record of another holder: {@link LockConflictException}</li>
     * </ul>
     *
     * @param lockType        {@code null} keeps the type of a lock the holder already has,
     *                        otherwise means {@link LockType#FIELD_EDIT}
     * @param durationMinutes hold time; {@code null} uses the lock type's default
     */
    public ResourceLock acquire(String resourceId, String holderId, @Nullable LockType lockType,
                                @Nullable Integer durationMinutes, @Nullable String reason) {
        requireId(resourceId, "resourceId", resourceId);
        requireId(resourceId, "holderId", holderId);
        if (durationMinutes != null) {
            checkDuration(resourceId, durationMinutes);
        }
        if (reason != null && reason.length() > config.getReasonMaxLength()) {
            throw new InvalidLockRequestException(resourceId,
                "Lock reason must be " + config.getReasonMaxLength() + " characters or less");
        }

        Instant now = clock.instant();
        Optional<ResourceLock> current = store.find(resourceId);

        if (current.isEmpty()) {
            LockType type = lockType != null ? lockType : LockType.FIELD_EDIT;
            Instant expiresAt = expiryFor(resourceId, type, durationMinutes, now);
            ResourceLock granted = new ResourceLock(resourceId, holderId, newToken(), type, now, expiresAt, reason);
            if (!store.insertIfAbsent(granted)) {
                throw lostRace(resourceId, now);
            }
            log.info("Lock acquired: resource={} holder={} type={} expires={}",
                resourceId, holderId, type.value(), expiresAt);
            return granted;
        }

        ResourceLock existing = current.get();
        if (existing.isValidAt(now)) {
            if (!existing.holderId().equals(holderId)) {
                throw new LockConflictException(resourceId, existing.holderId(), existing.expiresAt());
            }
            LockType type = lockType != null ? lockType : existing.lockType();
            Instant expiresAt = expiryFor(resourceId, type, durationMinutes, now);
            Instant refreshed = existing.expiresAt().isAfter(expiresAt) ? existing.expiresAt() : expiresAt;
            ResourceLock renewed = new ResourceLock(resourceId, holderId, existing.token(), type,
                existing.acquiredAt(), refreshed, reason != null ? reason : existing.reason());
            if (!store.replace(resourceId, existing.token(), renewed)) {
                throw lostRace(resourceId, now);
            }
            log.info("Lock refreshed: resource={} holder={} type={} expires={}",
                resourceId, holderId, type.value(), refreshed);
            return renewed;
        }

        LockType type = lockType != null ? lockType : LockType.FIELD_EDIT;
        Instant expiresAt = expiryFor(resourceId, type, durationMinutes, now);
        ResourceLock granted = new ResourceLock(resourceId, holderId, newToken(), type, now, expiresAt, reason);
        if (!store.replace(resourceId, existing.token(), granted)) {
            throw lostRace(resourceId, now);
        }
        log.info("Lock reclaimed: resource={} previousHolder={} expiredAt={} newHolder={}",
            resourceId, existing.holderId(), existing.expiresAt(), holderId);
        return granted;
    }

    private Instant expiryFor(String resourceId, LockType type, @Nullable Integer durationMinutes, Instant now) {
        int minutes = durationMinutes != null ? durationMinutes : type.defaultMinutes();
        checkDuration(resourceId, minutes);
        return now.plus(Duration.ofMinutes(minutes));
    }

    private void checkDuration(String resourceId, int minutes) {
        if (minutes < 1 || minutes > config.getMaxDurationMinutes()) {
            throw new InvalidLockRequestException(resourceId,
                "Lock duration must be between 1 and " + config.getMaxDurationMinutes() + " minutes, got " + minutes);
        }
    }

    /**
     * Drops the lock if {@code token} matches. Releasing a lock that is no
     * longer stored succeeds silently, so duplicate client calls are harmless.
     */
    public void release(String resourceId, String token) {
        requireId(resourceId, "token", token);
        Optional<ResourceLock> current = store.find(resourceId);
        if (current.isEmpty()) {
            log.debug("Release of unlocked resource={} ignored", resourceId);
            return;
        }
        if (!current.get().token().equals(token)) {
            throw new LockTokenMismatchException(resourceId);
        }
        if (!store.delete(resourceId, token) && store.find(resourceId).isPresent()) {
            // replaced between our read and the delete
            throw new LockTokenMismatchException(resourceId);
        }
        log.info("Lock released: resource={} holder={}", resourceId, current.get().holderId());
    }

    /** Pushes expiry to {@code max(now, expiresAt) + additionalMinutes}. */
    public ResourceLock extend(String resourceId, String token, int additionalMinutes) {
        requireId(resourceId, "token", token);
        if (additionalMinutes < 1 || additionalMinutes > config.getMaxExtensionMinutes()) {
            throw new InvalidLockRequestException(resourceId,
                "Extension must be between 1 and " + config.getMaxExtensionMinutes() + " minutes, got " + additionalMinutes);
        }
        Instant now = clock.instant();
        ResourceLock existing = store.find(resourceId)
            .orElseThrow(() -> new LockNotFoundException(resourceId));
        if (!existing.token().equals(token)) {
            throw new LockTokenMismatchException(resourceId);
        }
        if (!existing.isValidAt(now)) {
            throw new LockExpiredException(resourceId, existing.expiresAt());
        }

        Instant base = existing.expiresAt().isAfter(now) ? existing.expiresAt() : now;
        ResourceLock extended = existing.withExpiresAt(base.plus(Duration.ofMinutes(additionalMinutes)));
        if (!store.replace(resourceId, token, extended)) {
            ResourceLock after = store.find(resourceId)
                .orElseThrow(() -> new LockNotFoundException(resourceId));
            if (!after.token().equals(token)) {
                throw new LockTokenMismatchException(resourceId);
            }
            throw new LockConflictException(resourceId);
        }
        log.info("Lock extended: resource={} holder={} expires={}",
            resourceId, existing.holderId(), extended.expiresAt());
        return extended;
    }

    public boolean isValid(ResourceLock lock) {
        return lock.isValidAt(clock.instant());
    }

    /** Whether a still-valid lock has entered the auto-renew window. */
    public boolean isRenewalDue(ResourceLock lock) {
        Instant now = clock.instant();
        if (!lock.isValidAt(now)) {
            return false;
        }
        Duration remaining = Duration.between(now, lock.expiresAt());
        return remaining.compareTo(Duration.ofMinutes(config.getAutoRenewThresholdMinutes())) <= 0;
    }

    public Optional<ResourceLock> findActive(String resourceId) {
        Instant now = clock.instant();
        return store.find(resourceId).filter(l -> l.isValidAt(now));
    }

    public List<ResourceLock> listActive(@Nullable String resourceId) {
        return store.findActive(clock.instant(), resourceId);
    }

    /**
     * Checks that {@code holderId} currently holds a valid lock on the resource.
     * Used by collaborators that gate writes on lock ownership.
     */
    public ResourceLock verifyHolder(String resourceId, String holderId) {
        Instant now = clock.instant();
        ResourceLock lock = store.find(resourceId)
            .orElseThrow(() -> new LockNotFoundException(resourceId));
        if (!lock.isValidAt(now)) {
            throw new LockExpiredException(resourceId, lock.expiresAt());
        }
        if (!lock.holderId().equals(holderId)) {
            throw new LockConflictException(resourceId, lock.holderId(), lock.expiresAt());
        }
        return lock;
    }

    /** Removes expired records. Correctness never depends on it running. */
    public int cleanupExpired() {
        int deleted = store.deleteExpired(clock.instant());
        if (deleted > 0) {
            log.info("Cleaned {} expired resource locks", deleted);
        }
        return deleted;
    }

    @Scheduled(fixedDelay = "${designer.locks.cleanup-interval:60s}")
    void scheduledCleanup() {
        try {
            cleanupExpired();
        } catch (Exception e) {
            log.warn("Error cleaning expired locks: {}", e.getMessage());
        }
    }

    private LockConflictException lostRace(String resourceId, Instant now) {
        return store.find(resourceId)
            .filter(l -> l.isValidAt(now))
            .map(l -> new LockConflictException(resourceId, l.holderId(), l.expiresAt()))
            .orElseGet(() -> new LockConflictException(resourceId));
    }

    private static void requireId(String resourceId, String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidLockRequestException(resourceId, name + " must not be blank");
        }
    }

    private static String newToken() {
        return UUID.randomUUID().toString();
    }
}
