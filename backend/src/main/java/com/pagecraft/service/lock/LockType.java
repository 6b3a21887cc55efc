package com.pagecraft.service.lock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Arrays;

/** Kind of edit a lock protects, with its default hold time. */
@Serdeable
public enum LockType {
    SCHEMA_EDIT("schema_edit", 120),
    FIELD_EDIT("field_edit", 30),
    CRITICAL("critical", 240);

    private final String value;
    private final int defaultMinutes;

    LockType(String value, int defaultMinutes) {
        this.value = value;
        this.defaultMinutes = defaultMinutes;
    }

    @JsonValue
    public String value() { return value; }

    public int defaultMinutes() { return defaultMinutes; }

    @JsonCreator
    public static LockType of(String value) {
        return Arrays.stream(values())
            .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown lock type: " + value));
    }
}
