package com.pagecraft.service.responsive;

import com.fasterxml.jackson.annotation.JsonValue;
import com.pagecraft.domain.Breakpoint;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

import java.util.List;

/**
 * Authoring advice produced by {@link ResponsiveResolver#validateResponsiveConfig}.
 * Conflicts are data; nothing in the resolver throws them.
 */
@Serdeable
public record ResponsiveConflict(
    Type type,
    String componentId,
    List<Breakpoint> breakpoints,
    String message,
    Severity severity,
    @Nullable String suggestion
) {

    public ResponsiveConflict {
        breakpoints = List.copyOf(breakpoints);
    }

    @Serdeable
    public enum Type {
        VISIBILITY_CONFLICT("visibility_conflict"),
        STYLE_CONFLICT("style_conflict"),
        LAYOUT_CONFLICT("layout_conflict"),
        BREAKPOINT_OVERFLOW("breakpoint_overflow");

        private final String value;

        Type(String value) { this.value = value; }

        @JsonValue
        public String value() { return value; }
    }

    @Serdeable
    public enum Severity {
        WARNING("warning"),
        ERROR("error");

        private final String value;

        Severity(String value) { this.value = value; }

        @JsonValue
        public String value() { return value; }
    }
}
