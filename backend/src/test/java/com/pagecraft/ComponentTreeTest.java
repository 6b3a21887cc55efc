package com.pagecraft;

import com.pagecraft.domain.Breakpoint;
import com.pagecraft.service.registry.ComponentRegistry;
import com.pagecraft.service.tree.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentTreeTest {

    private final ComponentRegistry registry = new ComponentRegistry();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private ComponentTree tree;
    private String root;

    @BeforeEach
    void setup() {
        tree = ComponentTree.create(registry, "container", sequentialIds(), clock, 100);
        root = tree.getRootId();
    }

    private static Supplier<String> sequentialIds() {
        AtomicInteger next = new AtomicInteger();
        return () -> "c" + next.incrementAndGet();
    }

    /** Everything observable about the tree, for before/after comparisons. */
    private static List<String> fingerprint(ComponentTree tree) {
        List<String> lines = new ArrayList<>();
        for (ComponentInstance c : tree.snapshot()) {
            lines.add(c + " props=" + c.getProps() + " styles=" + c.getStyles() + " responsive=" + c.getResponsive());
        }
        return lines;
    }

    // ── create ─────────────────────────────────────────────────────────────

    @Test
    void create_rootHasRegistryDefaults() {
        ComponentInstance r = tree.get(root);

        assertThat(r.isRoot()).isTrue();
        assertThat(r.getType()).isEqualTo("container");
        assertThat(r.getStyles()).containsEntry("width", "100%");
        assertThat(tree.depthOf(root)).isZero();
    }

    @Test
    void create_leafRootType_isRejected() {
        assertThatThrownBy(() -> ComponentTree.create(registry, "button"))
            .isInstanceOf(InvalidParentException.class);
    }

    // ── insert ─────────────────────────────────────────────────────────────

    @Test
    void insert_appendsWithDefaultsAndDerivedDepth() {
        ComponentInstance row = tree.insert(root, "row");
        ComponentInstance col = tree.insert(row.getId(), "col");

        assertThat(tree.get(root).getChildren()).containsExactly(row.getId());
        assertThat(col.getParentId()).isEqualTo(row.getId());
        assertThat(col.getProps()).containsKey("col");
        assertThat(tree.depthOf(col.getId())).isEqualTo(2);
    }

    @Test
    void insert_indexIsClamped() {
        String a = tree.insert(root, "text").getId();
        String b = tree.insert(root, "text", 0).getId();
        String c = tree.insert(root, "text", 99).getId();
        String d = tree.insert(root, "text", -5).getId();
        String e = tree.insert(root, "text", 2).getId();

        assertThat(tree.get(root).getChildren()).containsExactly(d, b, e, a, c);
    }

    @Test
    void insert_underLeaf_failsWithInvalidParentAndLeavesTreeUnchanged() {
        String button = tree.insert(root, "button").getId();
        List<String> before = fingerprint(tree);

        assertThatThrownBy(() -> tree.insert(button, "text"))
            .isInstanceOf(InvalidParentException.class);
        assertThatThrownBy(() -> tree.insert(button, "carousel"))
            .isInstanceOf(InvalidParentException.class);
        assertThat(fingerprint(tree)).isEqualTo(before);
    }

    @Test
    void insert_missingParent_failsWithInvalidParent() {
        assertThatThrownBy(() -> tree.insert("nope", "text"))
            .isInstanceOf(InvalidParentException.class);
    }

    @Test
    void insert_unknownType_failsWithTypeNotAllowed() {
        assertThatThrownBy(() -> tree.insert(root, "carousel"))
            .isInstanceOf(TypeNotAllowedException.class);
    }

    @Test
    void insert_typeRejectedByParent_failsWithTypeNotAllowed() {
        String row = tree.insert(root, "row").getId();

        assertThatThrownBy(() -> tree.insert(row, "button"))
            .isInstanceOf(TypeNotAllowedException.class);
        assertThat(tree.get(row).getChildren()).isEmpty();
    }

    @Test
    void insert_beyondInheritedDepthLimit_failsWithDepthExceeded() {
        String parent = root;
        for (int i = 0; i < 5; i++) {
            parent = tree.insert(parent, "container").getId();
        }
        assertThat(tree.depthOf(parent)).isEqualTo(5);
        String deepest = parent;

        assertThatThrownBy(() -> tree.insert(deepest, "container"))
            .isInstanceOf(DepthExceededException.class);
        // a button allows depth 10 on its own, but its container ancestors cap it at 5
        assertThatThrownBy(() -> tree.insert(deepest, "button"))
            .isInstanceOf(DepthExceededException.class);
    }

    @Test
    void insert_pastChildLimit_failsWithChildLimitExceeded() {
        for (int i = 0; i < 50; i++) {
            tree.insert(root, "text");
        }

        assertThatThrownBy(() -> tree.insert(root, "text"))
            .isInstanceOf(ChildLimitExceededException.class);
        assertThat(tree.get(root).getChildren()).hasSize(50);
    }

    @Test
    void insert_rowPastTwelveCols_failsWithChildLimitExceeded() {
        String row = tree.insert(root, "row").getId();
        for (int i = 0; i < 12; i++) {
            tree.insert(row, "col");
        }

        assertThatThrownBy(() -> tree.insert(row, "col"))
            .isInstanceOf(ChildLimitExceededException.class);
        assertThat(tree.get(row).getChildren()).hasSize(12);
    }

    @Test
    void insert_colPastTwentyChildren_failsWithChildLimitExceeded() {
        String col = tree.insert(tree.insert(root, "row").getId(), "col").getId();
        for (int i = 0; i < 20; i++) {
            tree.insert(col, "text");
        }

        assertThatThrownBy(() -> tree.insert(col, "text"))
            .isInstanceOf(ChildLimitExceededException.class);
    }

    // ── move ───────────────────────────────────────────────────────────────

    @Test
    void move_intoOwnDescendant_failsWithCyclicMove() {
        String outer = tree.insert(root, "container").getId();
        String inner = tree.insert(outer, "container").getId();
        List<String> before = fingerprint(tree);

        assertThatThrownBy(() -> tree.move(outer, inner, null))
            .isInstanceOf(CyclicMoveException.class);
        assertThatThrownBy(() -> tree.move(outer, outer, null))
            .isInstanceOf(CyclicMoveException.class);
        assertThatThrownBy(() -> tree.move(root, outer, null))
            .isInstanceOf(CyclicMoveException.class);
        assertThat(fingerprint(tree)).isEqualTo(before);
    }

    @Test
    void move_reparentsAndUpdatesBothChildLists() {
        String left = tree.insert(root, "container").getId();
        String right = tree.insert(root, "container").getId();
        String text = tree.insert(left, "text").getId();

        ComponentInstance moved = tree.move(text, right, null);

        assertThat(moved.getParentId()).isEqualTo(right);
        assertThat(tree.get(left).getChildren()).isEmpty();
        assertThat(tree.get(right).getChildren()).containsExactly(text);
        assertThat(tree.validateTree()).isEmpty();
    }

    @Test
    void move_withinSameParent_indexCountsWithoutMovedInstance() {
        String a = tree.insert(root, "text").getId();
        String b = tree.insert(root, "text").getId();
        String c = tree.insert(root, "text").getId();

        tree.move(a, root, 2);
        assertThat(tree.get(root).getChildren()).containsExactly(b, c, a);

        tree.move(c, root, 0);
        assertThat(tree.get(root).getChildren()).containsExactly(c, b, a);
    }

    @Test
    void move_checksDepthOfWholeSubtree() {
        String chainTop = tree.insert(root, "container").getId();
        String parent = chainTop;
        for (int i = 0; i < 3; i++) {
            parent = tree.insert(parent, "container").getId();
        }
        // chainTop at depth 1, its deepest descendant at depth 4
        String sibling = tree.insert(root, "container").getId();
        String target = tree.insert(sibling, "container").getId();

        assertThatThrownBy(() -> tree.move(chainTop, target, null))
            .isInstanceOf(DepthExceededException.class);
        assertThat(tree.get(chainTop).getParentId()).isEqualTo(root);
    }

    @Test
    void move_intoFullParent_failsButReorderInFullParentSucceeds() {
        for (int i = 0; i < 49; i++) {
            tree.insert(root, "text");
        }
        String box = tree.insert(root, "container").getId();
        String inBox = tree.insert(box, "text").getId();

        assertThatThrownBy(() -> tree.move(inBox, root, null))
            .isInstanceOf(ChildLimitExceededException.class);
        tree.move(box, root, 0);
        assertThat(tree.get(root).getChildren().get(0)).isEqualTo(box);
    }

    @Test
    void move_unknownInstance_failsWithComponentNotFound() {
        assertThatThrownBy(() -> tree.move("ghost", root, null))
            .isInstanceOf(ComponentNotFoundException.class);
    }

    // ── remove / duplicate / update ────────────────────────────────────────

    @Test
    void remove_deletesWholeSubtree() {
        String row = tree.insert(root, "row").getId();
        String col = tree.insert(row, "col").getId();
        String text = tree.insert(col, "text").getId();
        String keep = tree.insert(root, "button").getId();

        List<String> removed = tree.remove(row);

        assertThat(removed).containsExactly(row, col, text);
        assertThat(tree.find(col)).isEmpty();
        assertThat(tree.get(root).getChildren()).containsExactly(keep);
        assertThat(tree.size()).isEqualTo(2);
    }

    @Test
    void remove_root_isRejected() {
        assertThatThrownBy(() -> tree.remove(root))
            .isInstanceOf(RootComponentException.class);
    }

    @Test
    void duplicate_deepCopiesWithFreshIdsRightAfterOriginal() {
        String row = tree.insert(root, "row").getId();
        String col = tree.insert(row, "col").getId();
        tree.insert(col, "text");
        String last = tree.insert(root, "button").getId();

        ComponentInstance copy = tree.duplicate(row);

        assertThat(copy.getId()).isNotEqualTo(row);
        assertThat(tree.get(root).getChildren()).containsExactly(row, copy.getId(), last);
        assertThat(copy.getChildren()).hasSize(1).doesNotContain(col);
        ComponentInstance copiedCol = tree.get(copy.getChildren().get(0));
        assertThat(copiedCol.getType()).isEqualTo("col");
        assertThat(copiedCol.getParentId()).isEqualTo(copy.getId());
        assertThat(copiedCol.getChildren()).hasSize(1);
        assertThat(tree.size()).isEqualTo(8);
        assertThat(tree.validateTree()).isEmpty();
    }

    @Test
    void update_mergesAndRemovesKeys() {
        String button = tree.insert(root, "button").getId();
        Map<String, Object> props = new HashMap<>();
        props.put("text", "Buy");
        props.put("disabled", null);

        ComponentInstance updated = tree.update(button, props, Map.of("color", "red"),
            Map.of(Breakpoint.MD, ResponsiveRule.visibility(false)));

        assertThat(updated.getProps()).containsEntry("text", "Buy").doesNotContainKey("disabled");
        assertThat(updated.getProps()).containsEntry("variant", "primary");
        assertThat(updated.getStyles()).containsEntry("color", "red");
        assertThat(updated.getResponsive()).containsKey(Breakpoint.MD);

        Map<Breakpoint, ResponsiveRule> clear = new HashMap<>();
        clear.put(Breakpoint.MD, null);
        assertThat(tree.update(button, null, null, clear).getResponsive()).isEmpty();
    }

    @Test
    void nestedValues_areNotSharedWithCallers() {
        Map<String, Object> span = new HashMap<>();
        span.put("span", 6);
        Map<String, Object> props = new HashMap<>();
        props.put("col", span);
        List<ComponentInstance> stored = List.of(
            new ComponentInstance("r", "container", null, List.of("c"), null, null, null),
            new ComponentInstance("c", "text", "r", List.of(), props, null,
                Map.of(Breakpoint.MD, ResponsiveRule.ofProps(props))));
        ComponentTree restored = ComponentTree.restore(registry, "r", stored, sequentialIds(), clock, 10);

        span.put("span", 1);
        Map<?, ?> nested = (Map<?, ?>) restored.get("c").getProps().get("col");
        Map<?, ?> nestedRule = (Map<?, ?>) restored.get("c").getResponsive().get(Breakpoint.MD).props().get("col");

        assertThat(nested.get("span")).isEqualTo(6);
        assertThat(nestedRule.get("span")).isEqualTo(6);
        assertThatThrownBy(() -> ((Map<String, Object>) nested).put("span", 2))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(((Map<?, ?>) restored.get("c").getProps().get("col")).get("span")).isEqualTo(6);
    }

    @Test
    void returnedInstances_areDetachedCopies() {
        ComponentInstance r = tree.get(root);

        assertThatThrownBy(() -> r.getChildren().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
        tree.insert(root, "text");
        assertThat(r.getChildren()).isEmpty();
    }

    // ── validation, history, statistics ────────────────────────────────────

    @Test
    void validateTree_staysCleanAfterRandomValidOperations() {
        Random random = new Random(42);
        String[] types = {"container", "row", "col", "button", "text", "image", "input"};

        for (int step = 0; step < 400; step++) {
            List<ComponentInstance> all = tree.snapshot();
            ComponentInstance target = all.get(random.nextInt(all.size()));
            try {
                switch (random.nextInt(4)) {
                    case 0, 1 -> tree.insert(target.getId(), types[random.nextInt(types.length)],
                        random.nextInt(4) - 1);
                    case 2 -> tree.move(target.getId(),
                        all.get(random.nextInt(all.size())).getId(), random.nextInt(3));
                    default -> {
                        if (!target.isRoot()) tree.remove(target.getId());
                    }
                }
            } catch (TreeOperationException rejected) {
                // rejected operations must leave no trace; checked below
            }
            assertThat(tree.validateTree()).as("after step %d", step).isEmpty();
        }
    }

    @Test
    void validateTree_reportsCorruptedStoredTree() {
        List<ComponentInstance> stored = List.of(
            new ComponentInstance("r", "container", null, List.of("a", "missing"), null, null, null),
            new ComponentInstance("a", "button", "r", List.of("b"), null, null, null),
            new ComponentInstance("b", "text", "a", List.of(), null, null, null),
            new ComponentInstance("lost", "text", "gone", List.of(), null, null, null),
            new ComponentInstance("odd", "widget", "r", List.of(), null, null, null));

        ComponentTree restored = ComponentTree.restore(registry, "r", stored, sequentialIds(), clock, 10);

        assertThat(restored.validateTree())
            .extracting(TreeViolation::kind)
            .contains(TreeViolation.Kind.DANGLING_CHILD,
                TreeViolation.Kind.INVALID_PARENT,
                TreeViolation.Kind.ORPHAN);
    }

    @Test
    void validateTree_detectsCycle() {
        List<ComponentInstance> stored = List.of(
            new ComponentInstance("r", "container", null, List.of("a"), null, null, null),
            new ComponentInstance("a", "container", "r", List.of("b"), null, null, null),
            new ComponentInstance("b", "container", "a", List.of("a"), null, null, null));

        ComponentTree restored = ComponentTree.restore(registry, "r", stored, sequentialIds(), clock, 10);

        assertThat(restored.validateTree())
            .extracting(TreeViolation::kind)
            .contains(TreeViolation.Kind.CYCLE);
    }

    @Test
    void cyclicOrphans_stillServeReadsAndRejectInserts() {
        List<ComponentInstance> stored = List.of(
            new ComponentInstance("r", "container", null, List.of("t"), null, null, null),
            new ComponentInstance("t", "text", "r", List.of(), null, null, null),
            new ComponentInstance("a", "container", "b", List.of("b"), null, null, null),
            new ComponentInstance("b", "container", "a", List.of("a"), null, null, null));
        ComponentTree restored = ComponentTree.restore(registry, "r", stored, sequentialIds(), clock, 10);

        TreeStatistics stats = restored.statistics();

        assertThat(stats.totalComponents()).isEqualTo(4);
        assertThat(stats.maxDepth()).isEqualTo(1);
        assertThat(restored.snapshot()).extracting(ComponentInstance::getId).containsExactly("r", "t", "a", "b");
        assertThat(restored.depthOf("a")).isEqualTo(ComponentTree.UNATTACHED);
        assertThat(restored.validateTree()).extracting(TreeViolation::kind).contains(TreeViolation.Kind.CYCLE);
        assertThatThrownBy(() -> restored.insert("a", "text"))
            .isInstanceOf(InvalidParentException.class);
        assertThat(restored.size()).isEqualTo(4);
    }

    @Test
    void history_isBoundedAndOrdered() {
        ComponentTree small = ComponentTree.create(registry, "container", sequentialIds(), clock, 3);
        String r = small.getRootId();
        String a = small.insert(r, "text").getId();
        small.insert(r, "text");
        small.insert(r, "text");
        small.move(a, r, 2);
        small.remove(a);

        assertThat(small.history())
            .extracting(HierarchyOperation::type)
            .containsExactly(HierarchyOperation.Type.ADD, HierarchyOperation.Type.MOVE,
                HierarchyOperation.Type.REMOVE);
    }

    @Test
    void statistics_countsTypesAndDepth() {
        String row = tree.insert(root, "row").getId();
        String col = tree.insert(row, "col").getId();
        tree.insert(col, "text");
        tree.insert(col, "text");

        TreeStatistics stats = tree.statistics();

        assertThat(stats.totalComponents()).isEqualTo(5);
        assertThat(stats.maxDepth()).isEqualTo(3);
        assertThat(stats.componentTypes()).containsEntry("text", 2).containsEntry("row", 1);
    }

    @Test
    void canPlaceInParent_delegatesToRegistry() {
        assertThat(tree.canPlaceInParent("col", "row")).isTrue();
        assertThat(tree.canPlaceInParent("text", "image")).isFalse();
    }
}
