package com.pagecraft.service.tree;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

import java.time.Instant;

/** Entry in a tree's bounded operation history. */
@Serdeable
public record HierarchyOperation(
    Type type,
    String componentId,
    @Nullable String parentId,
    @Nullable String oldParentId,
    @Nullable Integer position,
    @Nullable Integer oldPosition,
    Instant timestamp
) {

    @Serdeable
    public enum Type { ADD, REMOVE, MOVE, DUPLICATE, UPDATE }
}
