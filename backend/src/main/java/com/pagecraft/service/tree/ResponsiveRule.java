package com.pagecraft.service.tree;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Collections;
import java.util.Map;

/**
 * Partial override applied at one breakpoint. Absent maps and a {@code null}
 * visibility mean "inherit".
 */
@Serdeable
public record ResponsiveRule(
    @Nullable Map<String, Object> props,
    @Nullable Map<String, Object> styles,
    @Nullable Boolean visible
) {

    public ResponsiveRule {
        props = props == null ? null : Collections.unmodifiableMap(NestedValues.copyEntries(props));
        styles = styles == null ? null : Collections.unmodifiableMap(NestedValues.copyEntries(styles));
    }

    public static ResponsiveRule ofStyles(Map<String, Object> styles) {
        return new ResponsiveRule(null, styles, null);
    }

    public static ResponsiveRule ofProps(Map<String, Object> props) {
        return new ResponsiveRule(props, null, null);
    }

    public static ResponsiveRule visibility(boolean visible) {
        return new ResponsiveRule(null, null, visible);
    }

    public boolean overridesNothing() {
        return (props == null || props.isEmpty())
            && (styles == null || styles.isEmpty())
            && visible == null;
    }
}
