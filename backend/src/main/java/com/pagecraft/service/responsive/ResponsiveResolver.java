package com.pagecraft.service.responsive;

import com.pagecraft.domain.Breakpoint;
import com.pagecraft.service.tree.ComponentInstance;
import com.pagecraft.service.tree.ResponsiveRule;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds an instance's sparse per-breakpoint rules into the values in effect
 * at one breakpoint, and reports authoring conflicts between successive
 * breakpoints.
 *
 * Stateless: every call reads only its arguments and the immutable
 * configuration.
 */
@Singleton
public class ResponsiveResolver {

    private final ResponsiveConfiguration config;

    public ResponsiveResolver(ResponsiveConfiguration config) {
        this.config = config;
    }

    public CascadeOrder defaultOrder() {
        return config.getOrder();
    }

    public ResolvedComponent resolve(ComponentInstance instance, Breakpoint breakpoint) {
        return resolve(instance, breakpoint, config.getOrder());
    }

    /**
     * Starts from the base props/styles and applies each breakpoint's rule in
     * cascade order up to and including {@code breakpoint}. Keys are replaced
     * whole; a key absent at a later breakpoint keeps its earlier value.
     * Visibility follows the same walk and defaults to visible.
     */
    public ResolvedComponent resolve(ComponentInstance instance, Breakpoint breakpoint, CascadeOrder order) {
        Map<String, Object> props = new LinkedHashMap<>(instance.getProps());
        Map<String, Object> styles = new LinkedHashMap<>(instance.getStyles());
        boolean visible = true;

        for (Breakpoint bp : cascade(breakpoint, order)) {
            ResponsiveRule rule = instance.getResponsive().get(bp);
            if (rule == null) continue;
            if (rule.props() != null) props.putAll(rule.props());
            if (rule.styles() != null) styles.putAll(rule.styles());
            if (rule.visible() != null) visible = rule.visible();
        }
        return new ResolvedComponent(instance.getId(), breakpoint,
            Collections.unmodifiableMap(props), Collections.unmodifiableMap(styles), visible);
    }

    public ResolvedComponent resolveForWidth(ComponentInstance instance, int viewportWidth) {
        return resolve(instance, Breakpoint.forWidth(viewportWidth));
    }

    /** Breakpoints visited, in application order, when resolving at {@code target}. */
    static List<Breakpoint> cascade(Breakpoint target, CascadeOrder order) {
        List<Breakpoint> all = Breakpoint.ascending();
        if (order == CascadeOrder.DESKTOP_FIRST) {
            List<Breakpoint> walk = new ArrayList<>(all.subList(target.ordinal(), all.size()));
            Collections.reverse(walk);
            return walk;
        }
        return all.subList(0, target.ordinal() + 1);
    }

    // ── Conflict detection ──────────────────────────────────────────────────

    public List<ResponsiveConflict> validateResponsiveConfig(ComponentInstance instance) {
        return validateResponsiveConfig(instance, List.of());
    }

    /**
     * Advisory checks. {@code siblings} are the instance's fellow children and
     * only feed the grid overflow check; pass an empty collection when the
     * instance is checked on its own.
     */
    public List<ResponsiveConflict> validateResponsiveConfig(ComponentInstance instance,
                                                             Collection<ComponentInstance> siblings) {
        List<ResponsiveConflict> conflicts = new ArrayList<>();
        conflicts.addAll(checkVisibility(instance));
        conflicts.addAll(checkWidths(instance));
        if (config.getGridTypes().contains(instance.getType())) {
            conflicts.addAll(checkGrid(instance, siblings));
        }
        return conflicts;
    }

    /**
     * Compares each authored visibility with the previous authored one. Gaps
     * between them inherit, so the flip takes effect at the later breakpoint.
     */
    private List<ResponsiveConflict> checkVisibility(ComponentInstance instance) {
        List<ResponsiveConflict> conflicts = new ArrayList<>();
        Breakpoint lastAt = null;
        Boolean last = null;
        for (Breakpoint bp : Breakpoint.ascending()) {
            Boolean current = visibilityAt(instance, bp);
            if (current == null) continue;
            if (last != null && !last.equals(current)) {
                conflicts.add(new ResponsiveConflict(
                    ResponsiveConflict.Type.VISIBILITY_CONFLICT,
                    instance.getId(),
                    List.of(lastAt, bp),
                    "Visibility toggles between " + lastAt.key() + " and " + bp.key(),
                    ResponsiveConflict.Severity.WARNING,
                    "Check that hiding the component at one of these breakpoints is intended"));
            }
            lastAt = bp;
            last = current;
        }
        return conflicts;
    }

    private List<ResponsiveConflict> checkWidths(ComponentInstance instance) {
        List<ResponsiveConflict> conflicts = new ArrayList<>();
        Breakpoint lastAt = null;
        Object last = null;
        for (Breakpoint bp : Breakpoint.ascending()) {
            Object current = widthAt(instance, bp);
            if (current == null) continue;
            if (last != null
                && !String.valueOf(last).equals(String.valueOf(current))
                && !(isPercentage(last) && isPercentage(current))) {
                conflicts.add(new ResponsiveConflict(
                    ResponsiveConflict.Type.STYLE_CONFLICT,
                    instance.getId(),
                    List.of(lastAt, bp),
                    "Width jumps from " + last + " to " + current + " between "
                        + lastAt.key() + " and " + bp.key(),
                    ResponsiveConflict.Severity.WARNING,
                    "Use relative units or percentages for a smooth transition"));
            }
            lastAt = bp;
            last = current;
        }
        return conflicts;
    }

    /**
     * At every breakpoint where the instance authors a span, adds the spans
     * its siblings have in effect there (mobile-first) and flags sums above
     * the grid column count.
     */
    private List<ResponsiveConflict> checkGrid(ComponentInstance instance, Collection<ComponentInstance> siblings) {
        List<ResponsiveConflict> conflicts = new ArrayList<>();
        int columns = config.getGridColumns();
        for (Breakpoint bp : Breakpoint.ascending()) {
            ResponsiveRule rule = instance.getResponsive().get(bp);
            Integer own = rule == null ? null : span(rule.props());
            if (own == null) continue;

            int total = own;
            for (ComponentInstance sibling : siblings) {
                if (sibling.getId().equals(instance.getId())) continue;
                if (!config.getGridTypes().contains(sibling.getType())) continue;
                total += effectiveSpan(sibling, bp);
            }
            if (total > columns) {
                conflicts.add(new ResponsiveConflict(
                    ResponsiveConflict.Type.LAYOUT_CONFLICT,
                    instance.getId(),
                    List.of(bp),
                    "Column spans add up to " + total + " at " + bp.key() + ", the grid has " + columns,
                    ResponsiveConflict.Severity.ERROR,
                    "Adjust the span values so they add up to at most " + columns));
            }
        }
        return conflicts;
    }

    private static int effectiveSpan(ComponentInstance sibling, Breakpoint bp) {
        Integer span = span(sibling.getProps());
        for (Breakpoint step : cascade(bp, CascadeOrder.MOBILE_FIRST)) {
            ResponsiveRule rule = sibling.getResponsive().get(step);
            Integer authored = rule == null ? null : span(rule.props());
            if (authored != null) span = authored;
        }
        return span == null ? 0 : span;
    }

    /** Reads {@code span} or the nested {@code col.span}. */
    static Integer span(Map<String, Object> props) {
        if (props == null) return null;
        Object direct = props.get("span");
        if (direct instanceof Number n) return n.intValue();
        if (props.get("col") instanceof Map<?, ?> col && col.get("span") instanceof Number nested) {
            return nested.intValue();
        }
        Object dotted = props.get("col.span");
        if (dotted instanceof Number flat) return flat.intValue();
        return null;
    }

    private static Boolean visibilityAt(ComponentInstance instance, Breakpoint bp) {
        ResponsiveRule rule = instance.getResponsive().get(bp);
        return rule == null ? null : rule.visible();
    }

    private static Object widthAt(ComponentInstance instance, Breakpoint bp) {
        ResponsiveRule rule = instance.getResponsive().get(bp);
        return rule == null || rule.styles() == null ? null : rule.styles().get("width");
    }

    private static boolean isPercentage(Object value) {
        return value instanceof String s && s.trim().endsWith("%");
    }

    // ── Suggestions ─────────────────────────────────────────────────────────

    /** Clean-up hints: redundant rules, empty rules, and gaps at the common breakpoints. */
    public List<String> suggestOptimizations(ComponentInstance instance) {
        List<String> suggestions = new ArrayList<>();
        Map<Breakpoint, ResponsiveRule> rules = instance.getResponsive();

        List<Breakpoint> authored = Breakpoint.ascending().stream().filter(rules::containsKey).toList();
        for (int i = 1; i < authored.size(); i++) {
            ResponsiveRule previous = rules.get(authored.get(i - 1));
            ResponsiveRule current = rules.get(authored.get(i));
            if (!current.overridesNothing() && Objects.equals(previous, current)) {
                suggestions.add("Rule at " + authored.get(i).key() + " repeats the rule at "
                    + authored.get(i - 1).key() + " and can be removed");
            }
        }
        for (Breakpoint bp : authored) {
            if (rules.get(bp).overridesNothing()) {
                suggestions.add("Rule at " + bp.key() + " is empty and can be removed");
            }
        }
        if (!rules.isEmpty()) {
            List<String> missing = List.of(Breakpoint.SM, Breakpoint.MD, Breakpoint.LG).stream()
                .filter(bp -> !rules.containsKey(bp))
                .map(Breakpoint::key)
                .toList();
            if (!missing.isEmpty()) {
                suggestions.add("Consider adding rules for " + String.join(", ", missing));
            }
        }
        return suggestions;
    }
}
