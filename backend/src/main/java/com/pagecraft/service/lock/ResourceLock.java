package com.pagecraft.service.lock;

import io.micronaut.core.annotation.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Time-bounded grant of a resource to one holder. The token is the proof of
 * ownership required to release or extend.
 */
public record ResourceLock(
    String resourceId,
    String holderId,
    String token,
    LockType lockType,
    Instant acquiredAt,
    Instant expiresAt,
    @Nullable String reason
) {

    public ResourceLock {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(holderId, "holderId");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(lockType, "lockType");
        Objects.requireNonNull(acquiredAt, "acquiredAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isValidAt(Instant instant) {
        return instant.isBefore(expiresAt);
    }

    public ResourceLock withExpiresAt(Instant newExpiresAt) {
        return new ResourceLock(resourceId, holderId, token, lockType, acquiredAt, newExpiresAt, reason);
    }
}
