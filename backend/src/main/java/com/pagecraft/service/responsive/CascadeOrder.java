package com.pagecraft.service.responsive;

import io.micronaut.serde.annotation.Serdeable;

/** Direction in which per-breakpoint rules are folded onto the base values. */
@Serdeable
public enum CascadeOrder {
    /** Smallest breakpoint first; larger breakpoints override. */
    MOBILE_FIRST,
    /** Largest breakpoint first; smaller breakpoints override. */
    DESKTOP_FIRST
}
