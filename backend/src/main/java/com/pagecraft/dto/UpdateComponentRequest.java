package com.pagecraft.dto;

import com.pagecraft.service.tree.ResponsiveRule;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.Map;

@Serdeable
@Schema(description = "Partial update of a component; a null value removes the key")
public record UpdateComponentRequest(
    @Nullable Map<String, Object> props,
    @Nullable Map<String, Object> styles,
    @Nullable
    @Schema(description = "Rules to replace, keyed by breakpoint; a null rule removes the breakpoint")
    Map<String, ResponsiveRule> responsive
) {}
