package com.pagecraft.dto;

import com.pagecraft.service.tree.ResponsiveRule;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;

@Serdeable
@Schema(description = "Component instance")
public record ComponentResponse(
    String id,
    String type,
    @Nullable String parentId,
    List<String> children,
    Map<String, Object> props,
    Map<String, Object> styles,
    @Schema(description = "Per-breakpoint overrides keyed by breakpoint (xs, sm, md, lg, xl, 2xl)")
    Map<String, ResponsiveRule> responsive,
    @Schema(description = "Distance from the root (root = 0); -1 for a node on a parent cycle")
    int depth
) {}
