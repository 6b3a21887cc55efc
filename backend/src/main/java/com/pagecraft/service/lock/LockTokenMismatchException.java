package com.pagecraft.service.lock;

public class LockTokenMismatchException extends LockException {

    public LockTokenMismatchException(String resourceId) {
        super("LOCK_TOKEN_MISMATCH", resourceId,
            "Lock token does not match the current lock on resource " + resourceId);
    }
}
