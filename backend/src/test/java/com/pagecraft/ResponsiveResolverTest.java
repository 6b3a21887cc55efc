package com.pagecraft;

import com.pagecraft.domain.Breakpoint;
import com.pagecraft.service.responsive.CascadeOrder;
import com.pagecraft.service.responsive.ResolvedComponent;
import com.pagecraft.service.responsive.ResponsiveConfiguration;
import com.pagecraft.service.responsive.ResponsiveConflict;
import com.pagecraft.service.responsive.ResponsiveResolver;
import com.pagecraft.service.tree.ComponentInstance;
import com.pagecraft.service.tree.ResponsiveRule;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponsiveResolverTest {

    private final ResponsiveResolver resolver = new ResponsiveResolver(new ResponsiveConfiguration());

    private static ComponentInstance instance(String id, String type,
                                              Map<String, Object> props,
                                              Map<String, Object> styles,
                                              Map<Breakpoint, ResponsiveRule> rules) {
        return new ComponentInstance(id, type, "parent", List.of(), props, styles, rules);
    }

    private static Map<Breakpoint, ResponsiveRule> rules(Object... pairs) {
        Map<Breakpoint, ResponsiveRule> rules = new EnumMap<>(Breakpoint.class);
        for (int i = 0; i < pairs.length; i += 2) {
            rules.put((Breakpoint) pairs[i], (ResponsiveRule) pairs[i + 1]);
        }
        return rules;
    }

    // ── resolution ─────────────────────────────────────────────────────────

    @Test
    void mobileFirst_inheritsFromNearestSmallerBreakpoint() {
        ComponentInstance c = instance("c", "container", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.ofStyles(Map.of("width", 100)),
            Breakpoint.LG, ResponsiveRule.ofStyles(Map.of("width", 300))));

        assertThat(resolver.resolve(c, Breakpoint.XS).styles()).doesNotContainKey("width");
        assertThat(resolver.resolve(c, Breakpoint.MD).styles()).containsEntry("width", 100);
        assertThat(resolver.resolve(c, Breakpoint.XL).styles()).containsEntry("width", 300);
    }

    @Test
    void desktopFirst_inheritsFromNearestLargerBreakpoint() {
        ComponentInstance c = instance("c", "container", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.ofStyles(Map.of("width", 100)),
            Breakpoint.LG, ResponsiveRule.ofStyles(Map.of("width", 300))));

        assertThat(resolver.resolve(c, Breakpoint.MD, CascadeOrder.DESKTOP_FIRST).styles())
            .containsEntry("width", 300);
        assertThat(resolver.resolve(c, Breakpoint.XS, CascadeOrder.DESKTOP_FIRST).styles())
            .containsEntry("width", 100);
        assertThat(resolver.resolve(c, Breakpoint.XXL, CascadeOrder.DESKTOP_FIRST).styles())
            .doesNotContainKey("width");
    }

    @Test
    void configuredOrder_isTheDefault() {
        ResponsiveConfiguration config = new ResponsiveConfiguration();
        config.setOrder(CascadeOrder.DESKTOP_FIRST);
        ResponsiveResolver desktopFirst = new ResponsiveResolver(config);
        ComponentInstance c = instance("c", "text", Map.of(), Map.of(), rules(
            Breakpoint.LG, ResponsiveRule.ofStyles(Map.of("fontSize", 20))));

        assertThat(desktopFirst.resolve(c, Breakpoint.SM).styles()).containsEntry("fontSize", 20);
        assertThat(resolver.resolve(c, Breakpoint.SM).styles()).doesNotContainKey("fontSize");
    }

    @Test
    void merge_isShallowPerKey() {
        ComponentInstance c = instance("c", "button",
            Map.of("text", "Buy", "size", "md"),
            Map.of("color", "red", "padding", 4),
            rules(Breakpoint.SM, new ResponsiveRule(Map.of("size", "lg"), Map.of("color", "blue"), null)));

        ResolvedComponent resolved = resolver.resolve(c, Breakpoint.MD);

        assertThat(resolved.props()).containsEntry("text", "Buy").containsEntry("size", "lg");
        assertThat(resolved.styles()).containsEntry("color", "blue").containsEntry("padding", 4);
    }

    @Test
    void visibility_defaultsToVisibleAndFollowsCascade() {
        ComponentInstance c = instance("c", "image", Map.of(), Map.of(), rules(
            Breakpoint.MD, ResponsiveRule.visibility(false)));

        assertThat(resolver.resolve(c, Breakpoint.SM).visible()).isTrue();
        assertThat(resolver.resolve(c, Breakpoint.MD).visible()).isFalse();
        assertThat(resolver.resolve(c, Breakpoint.XXL).visible()).isFalse();
        assertThat(resolver.resolve(c, Breakpoint.XL, CascadeOrder.DESKTOP_FIRST).visible()).isTrue();
        assertThat(resolver.resolve(c, Breakpoint.SM, CascadeOrder.DESKTOP_FIRST).visible()).isFalse();
    }

    @Test
    void resolve_isIdempotent() {
        ComponentInstance c = instance("c", "text", Map.of("content", "Hi"), Map.of("margin", 2), rules(
            Breakpoint.XS, ResponsiveRule.ofStyles(Map.of("margin", 1)),
            Breakpoint.XL, ResponsiveRule.visibility(false)));

        for (Breakpoint bp : Breakpoint.ascending()) {
            assertThat(resolver.resolve(c, bp)).isEqualTo(resolver.resolve(c, bp));
        }
    }

    @Test
    void resolveForWidth_picksBreakpointByThreshold() {
        ComponentInstance c = instance("c", "text", Map.of(), Map.of(), rules(
            Breakpoint.LG, ResponsiveRule.ofStyles(Map.of("width", 300))));

        assertThat(resolver.resolveForWidth(c, 1023).breakpoint()).isEqualTo(Breakpoint.MD);
        assertThat(resolver.resolveForWidth(c, 1024).styles()).containsEntry("width", 300);
    }

    // ── conflicts ──────────────────────────────────────────────────────────

    @Test
    void visibilityToggleBetweenAdjacentBreakpoints_isWarning() {
        ComponentInstance c = instance("c", "text", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.visibility(true),
            Breakpoint.MD, ResponsiveRule.visibility(false),
            Breakpoint.XL, ResponsiveRule.visibility(true)));

        List<ResponsiveConflict> conflicts = resolver.validateResponsiveConfig(c);

        assertThat(conflicts).hasSize(2);
        ResponsiveConflict conflict = conflicts.get(0);
        assertThat(conflict.type()).isEqualTo(ResponsiveConflict.Type.VISIBILITY_CONFLICT);
        assertThat(conflict.severity()).isEqualTo(ResponsiveConflict.Severity.WARNING);
        assertThat(conflict.breakpoints()).containsExactly(Breakpoint.SM, Breakpoint.MD);
        assertThat(conflicts.get(1).breakpoints()).containsExactly(Breakpoint.MD, Breakpoint.XL);
    }

    @Test
    void visibilityToggleAcrossInheritedGap_isWarning() {
        ComponentInstance c = instance("c", "text", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.visibility(false),
            Breakpoint.LG, ResponsiveRule.visibility(true)));

        assertThat(resolver.validateResponsiveConfig(c)).singleElement().satisfies(conflict -> {
            assertThat(conflict.type()).isEqualTo(ResponsiveConflict.Type.VISIBILITY_CONFLICT);
            assertThat(conflict.breakpoints()).containsExactly(Breakpoint.SM, Breakpoint.LG);
        });
    }

    @Test
    void widthJumpAcrossInheritedGap_isWarning() {
        ComponentInstance c = instance("c", "container", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.ofStyles(Map.of("width", "200px")),
            Breakpoint.LG, ResponsiveRule.ofStyles(Map.of("width", "900px"))));

        assertThat(resolver.validateResponsiveConfig(c)).singleElement().satisfies(conflict -> {
            assertThat(conflict.type()).isEqualTo(ResponsiveConflict.Type.STYLE_CONFLICT);
            assertThat(conflict.breakpoints()).containsExactly(Breakpoint.SM, Breakpoint.LG);
        });
    }

    @Test
    void sameVisibilityAcrossGap_isNotAConflict() {
        ComponentInstance c = instance("c", "text", Map.of(), Map.of(), rules(
            Breakpoint.XS, ResponsiveRule.visibility(false),
            Breakpoint.XL, ResponsiveRule.visibility(false)));

        assertThat(resolver.validateResponsiveConfig(c)).isEmpty();
    }

    @Test
    void abruptWidthChange_isWarningUnlessBothArePercentages() {
        ComponentInstance fixed = instance("fixed", "container", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.ofStyles(Map.of("width", "200px")),
            Breakpoint.MD, ResponsiveRule.ofStyles(Map.of("width", "600px"))));
        ComponentInstance relative = instance("relative", "container", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.ofStyles(Map.of("width", "50%")),
            Breakpoint.MD, ResponsiveRule.ofStyles(Map.of("width", "100%"))));
        ComponentInstance mixed = instance("mixed", "container", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.ofStyles(Map.of("width", "50%")),
            Breakpoint.MD, ResponsiveRule.ofStyles(Map.of("width", 300))));

        assertThat(resolver.validateResponsiveConfig(fixed))
            .singleElement()
            .satisfies(c -> {
                assertThat(c.type()).isEqualTo(ResponsiveConflict.Type.STYLE_CONFLICT);
                assertThat(c.severity()).isEqualTo(ResponsiveConflict.Severity.WARNING);
            });
        assertThat(resolver.validateResponsiveConfig(relative)).isEmpty();
        assertThat(resolver.validateResponsiveConfig(mixed)).hasSize(1);
    }

    @Test
    void gridSpanOverflowWithSibling_isSingleError() {
        ComponentInstance col = instance("col-a", "col", Map.of(), Map.of(), rules(
            Breakpoint.XS, ResponsiveRule.ofProps(Map.of("span", 8)),
            Breakpoint.SM, ResponsiveRule.ofProps(Map.of("span", 6))));
        ComponentInstance sibling = instance("col-b", "col", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.ofProps(Map.of("col", Map.of("span", 7)))));

        List<ResponsiveConflict> conflicts = resolver.validateResponsiveConfig(col, List.of(col, sibling));

        assertThat(conflicts).singleElement().satisfies(c -> {
            assertThat(c.type()).isEqualTo(ResponsiveConflict.Type.LAYOUT_CONFLICT);
            assertThat(c.severity()).isEqualTo(ResponsiveConflict.Severity.ERROR);
            assertThat(c.breakpoints()).containsExactly(Breakpoint.SM);
        });
    }

    @Test
    void gridSpan_siblingBaseSpanCountsUntilOverridden() {
        ComponentInstance col = instance("col-a", "col", Map.of(), Map.of(), rules(
            Breakpoint.MD, ResponsiveRule.ofProps(Map.of("span", 6))));
        ComponentInstance fullWidth = instance("col-b", "col", Map.of("col", Map.of("span", 12)), Map.of(), rules());
        ComponentInstance halfAtMd = instance("col-c", "col", Map.of("col", Map.of("span", 12)), Map.of(), rules(
            Breakpoint.MD, ResponsiveRule.ofProps(Map.of("span", 6))));

        assertThat(resolver.validateResponsiveConfig(col, List.of(fullWidth))).hasSize(1);
        assertThat(resolver.validateResponsiveConfig(col, List.of(halfAtMd))).isEmpty();
    }

    @Test
    void gridCheck_onlyAppliesToGridTypes() {
        ComponentInstance text = instance("t", "text", Map.of(), Map.of(), rules(
            Breakpoint.XS, ResponsiveRule.ofProps(Map.of("span", 20))));

        assertThat(resolver.validateResponsiveConfig(text)).isEmpty();
    }

    // ── suggestions ────────────────────────────────────────────────────────

    @Test
    void suggestOptimizations_flagsDuplicateEmptyAndMissingRules() {
        ComponentInstance c = instance("c", "text", Map.of(), Map.of(), rules(
            Breakpoint.SM, ResponsiveRule.ofStyles(Map.of("width", 100)),
            Breakpoint.MD, ResponsiveRule.ofStyles(Map.of("width", 100)),
            Breakpoint.XL, new ResponsiveRule(null, null, null)));

        List<String> suggestions = resolver.suggestOptimizations(c);

        assertThat(suggestions).hasSize(3);
        assertThat(suggestions).anyMatch(s -> s.contains("md") && s.contains("repeats"));
        assertThat(suggestions).anyMatch(s -> s.contains("xl") && s.contains("empty"));
        assertThat(suggestions).anyMatch(s -> s.contains("lg"));
    }

    @Test
    void suggestOptimizations_noRules_noSuggestions() {
        assertThat(resolver.suggestOptimizations(instance("c", "text", Map.of(), Map.of(), rules()))).isEmpty();
    }
}
