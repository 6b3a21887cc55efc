package com.pagecraft.service.responsive;

import com.pagecraft.domain.Breakpoint;
import io.micronaut.serde.annotation.Serdeable;

import java.util.Map;

/** Effective values of one instance at one breakpoint. */
@Serdeable
public record ResolvedComponent(
    String componentId,
    Breakpoint breakpoint,
    Map<String, Object> props,
    Map<String, Object> styles,
    boolean visible
) {}
