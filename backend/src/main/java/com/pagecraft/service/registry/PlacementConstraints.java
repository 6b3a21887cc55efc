package com.pagecraft.service.registry;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Set;

/**
 * Placement rules for one component type.
 *
 * A {@code null} set or limit means unrestricted. {@code maxDepth} is inherited
 * down the tree: an instance's depth is bounded by the smallest {@code maxDepth}
 * declared on itself or on any ancestor.
 *
 * @param canContainChildren whether instances of this type accept children at all
 * @param maxDepth           deepest level (root = 0) at which this type, and anything below it, may sit
 * @param allowedParents     parent types this type may be placed under
 * @param allowedChildren    child types this type accepts
 * @param maxChildren        upper bound on direct children
 */
@Serdeable
public record PlacementConstraints(
    boolean canContainChildren,
    @Nullable Integer maxDepth,
    @Nullable Set<String> allowedParents,
    @Nullable Set<String> allowedChildren,
    @Nullable Integer maxChildren
) {

    public static final PlacementConstraints UNRESTRICTED =
        new PlacementConstraints(true, null, null, null, null);

    public PlacementConstraints {
        if (maxDepth != null && maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        if (maxChildren != null && maxChildren < 0) {
            throw new IllegalArgumentException("maxChildren must be >= 0");
        }
        allowedParents = allowedParents == null ? null : Set.copyOf(allowedParents);
        allowedChildren = allowedChildren == null ? null : Set.copyOf(allowedChildren);
    }

    public static PlacementConstraints leaf(int maxDepth, Set<String> allowedParents) {
        return new PlacementConstraints(false, maxDepth, allowedParents, null, null);
    }

    public static PlacementConstraints container(int maxDepth, Set<String> allowedParents) {
        return new PlacementConstraints(true, maxDepth, allowedParents, null, null);
    }

    public PlacementConstraints withAllowedChildren(Set<String> children) {
        return new PlacementConstraints(canContainChildren, maxDepth, allowedParents, children, maxChildren);
    }

    public PlacementConstraints withMaxChildren(int limit) {
        return new PlacementConstraints(canContainChildren, maxDepth, allowedParents, allowedChildren, limit);
    }

    public boolean acceptsParent(String parentType) {
        return allowedParents == null || allowedParents.isEmpty() || allowedParents.contains(parentType);
    }

    public boolean acceptsChild(String childType) {
        return allowedChildren == null || allowedChildren.isEmpty() || allowedChildren.contains(childType);
    }
}
