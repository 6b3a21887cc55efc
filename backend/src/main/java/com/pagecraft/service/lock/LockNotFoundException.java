package com.pagecraft.service.lock;

public class LockNotFoundException extends LockException {

    public LockNotFoundException(String resourceId) {
        super("LOCK_NOT_FOUND", resourceId, "No lock held on resource " + resourceId);
    }
}
