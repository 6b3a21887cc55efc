package com.pagecraft.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Viewport breakpoints, ordered from the smallest to the largest.
 *
 * Thresholds are minimum widths in CSS pixels and strictly increase with
 * {@link #ordinal()}, so enum order is the cascade order.
 */
@Serdeable
public enum Breakpoint {
    XS("xs", 0, 100),
    SM("sm", 640, 640),
    MD("md", 768, 768),
    LG("lg", 1024, 1024),
    XL("xl", 1280, 1280),
    XXL("2xl", 1536, 1536);

    private static final List<Breakpoint> ASCENDING = List.of(values());

    private final String key;
    private final int minWidth;
    private final int containerWidth;

    Breakpoint(String key, int minWidth, int containerWidth) {
        this.key = key;
        this.minWidth = minWidth;
        this.containerWidth = containerWidth;
    }

    @JsonValue
    public String key() { return key; }
    public int minWidth() { return minWidth; }

    /** Container max width; {@code xs} is fluid and reports 100 (percent). */
    public int containerWidth() { return containerWidth; }

    public static List<Breakpoint> ascending() {
        return ASCENDING;
    }

    /** Largest breakpoint whose threshold is at or below {@code width}. */
    public static Breakpoint forWidth(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("Viewport width must be non-negative: " + width);
        }
        Breakpoint match = XS;
        for (Breakpoint bp : ASCENDING) {
            if (width >= bp.minWidth) {
                match = bp;
            }
        }
        return match;
    }

    @JsonCreator
    public static Breakpoint of(String key) {
        return fromKey(key)
            .orElseThrow(() -> new IllegalArgumentException("Unknown breakpoint: " + key));
    }

    public static Optional<Breakpoint> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
            .filter(bp -> bp.key.equalsIgnoreCase(key) || bp.name().equalsIgnoreCase(key))
            .findFirst();
    }
}
