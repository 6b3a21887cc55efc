package com.pagecraft.service;

import com.pagecraft.service.tree.ResponsiveRule;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

import java.util.List;
import java.util.Map;

/**
 * Stored form of a component tree. Responsive rules are keyed by breakpoint
 * key ({@code xs}, {@code sm}, ... {@code 2xl}).
 */
@Serdeable
public record TreeSnapshot(String rootId, List<Node> components) {

    @Serdeable
    public record Node(
        String id,
        String type,
        @Nullable String parentId,
        List<String> children,
        Map<String, Object> props,
        Map<String, Object> styles,
        Map<String, ResponsiveRule> responsive
    ) {}
}
