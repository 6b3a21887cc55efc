package com.pagecraft.service.lock;

import java.time.Instant;

public class LockExpiredException extends LockException {

    private final Instant expiredAt;

    public LockExpiredException(String resourceId, Instant expiredAt) {
        super("LOCK_EXPIRED", resourceId,
            "Lock on resource " + resourceId + " expired at " + expiredAt + ", acquire it again");
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() { return expiredAt; }
}
