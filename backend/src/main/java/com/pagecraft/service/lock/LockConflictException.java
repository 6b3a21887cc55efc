package com.pagecraft.service.lock;

import java.time.Instant;

/**
 * Another holder owns a valid lock on the resource. Carries the holder and
 * expiry so the caller can show "locked by X until Y".
 */
public class LockConflictException extends LockException {

    private final String holderId;
    private final Instant expiresAt;

    public LockConflictException(String resourceId, String holderId, Instant expiresAt) {
        super("LOCK_CONFLICT", resourceId,
            "Resource " + resourceId + " is locked by " + holderId + " until " + expiresAt);
        this.holderId = holderId;
        this.expiresAt = expiresAt;
    }

    /** Lost a compare-and-swap against a writer that has since gone away. */
    public LockConflictException(String resourceId) {
        super("LOCK_CONFLICT", resourceId,
            "Resource " + resourceId + " was modified concurrently, retry the request");
        this.holderId = null;
        this.expiresAt = null;
    }

    public String getHolderId() { return holderId; }
    public Instant getExpiresAt() { return expiresAt; }
}
