package com.pagecraft.service.tree;

import io.micronaut.serde.annotation.Serdeable;

/** Integrity problem reported by {@link ComponentTree#validateTree()}. */
@Serdeable
public record TreeViolation(Kind kind, String componentId, String message) {

    @Serdeable
    public enum Kind {
        ORPHAN,
        DANGLING_CHILD,
        DUPLICATE_CHILD,
        CYCLE,
        UNKNOWN_TYPE,
        INVALID_PARENT,
        TYPE_NOT_ALLOWED,
        DEPTH_EXCEEDED,
        CHILD_LIMIT_EXCEEDED
    }
}
