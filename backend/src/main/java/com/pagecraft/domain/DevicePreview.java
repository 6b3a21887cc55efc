package com.pagecraft.domain;

import io.micronaut.serde.annotation.Serdeable;

import java.util.Arrays;
import java.util.Optional;

/**
 * Designer canvas presets. Each preset is a viewport width that maps onto the
 * {@link Breakpoint} table.
 */
@Serdeable
public enum DevicePreview {
    MOBILE("mobile", 0),
    TABLET("tablet", 768),
    DESKTOP("desktop", 1024);

    private final String key;
    private final int minWidth;

    DevicePreview(String key, int minWidth) {
        this.key = key;
        this.minWidth = minWidth;
    }

    public String key() { return key; }
    public int minWidth() { return minWidth; }

    public Breakpoint breakpoint() {
        return Breakpoint.forWidth(minWidth);
    }

    public static DevicePreview forWidth(int width) {
        if (width >= DESKTOP.minWidth) return DESKTOP;
        if (width >= TABLET.minWidth) return TABLET;
        return MOBILE;
    }

    public static Optional<DevicePreview> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
            .filter(d -> d.key.equalsIgnoreCase(key))
            .findFirst();
    }
}
