package com.pagecraft.service.registry;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Map;
import java.util.Objects;

/**
 * Registered component type: defaults copied onto new instances plus the
 * placement rules the tree enforces.
 */
@Serdeable
public record ComponentDefinition(
    String type,
    String name,
    String category,
    @Nullable String description,
    Map<String, Object> defaultProps,
    Map<String, Object> defaultStyles,
    PlacementConstraints constraints
) {

    public ComponentDefinition {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Component type must not be blank");
        }
        defaultProps = defaultProps == null ? Map.of() : Map.copyOf(defaultProps);
        defaultStyles = defaultStyles == null ? Map.of() : Map.copyOf(defaultStyles);
        constraints = constraints == null ? PlacementConstraints.UNRESTRICTED : constraints;
    }
}
