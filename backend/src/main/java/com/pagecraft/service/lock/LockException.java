package com.pagecraft.service.lock;

import com.pagecraft.service.DesignerException;

/** Lock-domain failure. Never retried by the lock manager itself. */
public abstract class LockException extends DesignerException {

    private final String resourceId;

    protected LockException(String code, String resourceId, String message) {
        super(code, message);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
