package com.pagecraft.service.lock;

public class InvalidLockRequestException extends LockException {

    public InvalidLockRequestException(String resourceId, String message) {
        super("INVALID_LOCK_REQUEST", resourceId, message);
    }
}
