package com.pagecraft.service.tree;

import com.pagecraft.domain.Breakpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a component tree.
 *
 * Instances handed out by {@link ComponentTree} are detached copies; only the
 * tree mutates its own arena. Depth is not stored: it is always derived from
 * the parent chain.
 */
public class ComponentInstance {

    private final String id;
    private final String type;
    private String parentId;
    private final List<String> children;
    private final Map<String, Object> props;
    private final Map<String, Object> styles;
    private final EnumMap<Breakpoint, ResponsiveRule> responsive;

    public ComponentInstance(String id, String type, String parentId,
                             List<String> children,
                             Map<String, Object> props,
                             Map<String, Object> styles,
                             Map<Breakpoint, ResponsiveRule> responsive) {
        this.id = id;
        this.type = type;
        this.parentId = parentId;
        this.children = new ArrayList<>(children != null ? children : List.of());
        this.props = NestedValues.copyEntries(props != null ? props : Map.of());
        this.styles = NestedValues.copyEntries(styles != null ? styles : Map.of());
        this.responsive = new EnumMap<>(Breakpoint.class);
        if (responsive != null) {
            this.responsive.putAll(responsive);
        }
    }

    public ComponentInstance(String id, String type, String parentId) {
        this(id, type, parentId, null, null, null, null);
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public String getParentId() { return parentId; }
    public boolean isRoot() { return parentId == null; }

    public List<String> getChildren() { return Collections.unmodifiableList(children); }
    public Map<String, Object> getProps() { return Collections.unmodifiableMap(props); }
    public Map<String, Object> getStyles() { return Collections.unmodifiableMap(styles); }
    public Map<Breakpoint, ResponsiveRule> getResponsive() { return Collections.unmodifiableMap(responsive); }

    public ComponentInstance copy() {
        return new ComponentInstance(id, type, parentId, children, props, styles, responsive);
    }

    // ── Arena mutators (ComponentTree only) ─────────────────────────────────

    void setParentId(String parentId) { this.parentId = parentId; }
    List<String> mutableChildren() { return children; }
    Map<String, Object> mutableProps() { return props; }
    Map<String, Object> mutableStyles() { return styles; }
    Map<Breakpoint, ResponsiveRule> mutableResponsive() { return responsive; }

    @Override
    public String toString() {
        return "ComponentInstance{id=" + id + ", type=" + type + ", parentId=" + parentId
            + ", children=" + children + "}";
    }
}
