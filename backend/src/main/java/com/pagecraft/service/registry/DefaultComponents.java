package com.pagecraft.service.registry;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in palette registered at startup.
 *
 *   basic  (button, input, text, image): leaves, maxDepth 10
 *   layout (container, row, col)       : containers, maxDepth 5
 *
 * A row only accepts cols. Direct children are capped at 50 per container,
 * 12 per row and 20 per col.
 */
public final class DefaultComponents {

    public static final String CATEGORY_BASIC = "basic";
    public static final String CATEGORY_LAYOUT = "layout";

    static final Set<String> LAYOUT_TYPES = Set.of("container", "row", "col");
    static final int BASIC_MAX_DEPTH = 10;
    static final int LAYOUT_MAX_DEPTH = 5;
    static final int CONTAINER_MAX_CHILDREN = 50;
    static final int ROW_MAX_CHILDREN = 12;
    static final int COL_MAX_CHILDREN = 20;

    private DefaultComponents() {}

    public static List<ComponentDefinition> all() {
        PlacementConstraints basic = PlacementConstraints.leaf(BASIC_MAX_DEPTH, LAYOUT_TYPES);
        PlacementConstraints layout = PlacementConstraints.container(LAYOUT_MAX_DEPTH, LAYOUT_TYPES);

        return List.of(
            new ComponentDefinition("button", "Button", CATEGORY_BASIC, "Clickable action button",
                Map.of("text", "Click me", "variant", "primary", "size", "md", "disabled", false),
                Map.of(), basic),
            new ComponentDefinition("input", "Input", CATEGORY_BASIC, "Single-line text input",
                Map.of("type", "text", "required", false, "disabled", false),
                Map.of(), basic),
            new ComponentDefinition("text", "Text", CATEGORY_BASIC, "Static text block",
                Map.of("content", "Text", "variant", "body", "size", "base"),
                Map.of(), basic),
            new ComponentDefinition("image", "Image", CATEGORY_BASIC, "Image display",
                Map.of("src", "/api/placeholder/300/200", "alt", "Image", "width", 300, "height", 200),
                Map.of(), basic),
            new ComponentDefinition("container", "Container", CATEGORY_LAYOUT,
                "Generic container that can hold any other component",
                Map.of("container", Map.of("direction", "column", "gap", 0)),
                Map.of("width", "100%"),
                layout.withMaxChildren(CONTAINER_MAX_CHILDREN)),
            new ComponentDefinition("row", "Row", CATEGORY_LAYOUT, "Horizontal row holding grid columns",
                Map.of("row", Map.of("gap", 16, "justify", "start")),
                Map.of("width", "100%"),
                layout.withAllowedChildren(Set.of("col")).withMaxChildren(ROW_MAX_CHILDREN)),
            new ComponentDefinition("col", "Column", CATEGORY_LAYOUT, "Grid column inside a row",
                Map.of("col", Map.of("span", 12)),
                Map.of(), layout.withMaxChildren(COL_MAX_CHILDREN))
        );
    }
}
