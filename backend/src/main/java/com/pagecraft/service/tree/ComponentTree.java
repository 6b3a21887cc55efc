package com.pagecraft.service.tree;

import com.pagecraft.domain.Breakpoint;
import com.pagecraft.service.registry.ComponentDefinition;
import com.pagecraft.service.registry.ComponentRegistry;
import com.pagecraft.service.registry.PlacementConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Arena of {@link ComponentInstance}s for one design, indexed by id.
 *
 * Every mutation validates first and only then splices, under the write lock,
 * so a rejected call leaves the tree untouched and concurrent readers never
 * observe a half-applied change. Readers receive detached copies.
 *
 * Depth limits are inherited: an instance at depth {@code d} must satisfy
 * {@code d <= maxDepth} for its own type and for every ancestor that declares
 * one (the most restrictive wins). The root sits at depth 0.
 */
public class ComponentTree {

    private static final Logger log = LoggerFactory.getLogger(ComponentTree.class);
    static final int DEFAULT_HISTORY_SIZE = 100;

    /** Depth reported for a node whose parent chain loops instead of reaching the root. */
    public static final int UNATTACHED = -1;

    private final ComponentRegistry registry;
    private final Supplier<String> idGenerator;
    private final Clock clock;
    private final int historySize;
    private final String rootId;
    private final Map<String, ComponentInstance> arena = new HashMap<>();
    private final Deque<HierarchyOperation> history = new ArrayDeque<>();
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    private ComponentTree(ComponentRegistry registry, Supplier<String> idGenerator, Clock clock,
                          int historySize, String rootId) {
        this.registry = registry;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.historySize = historySize;
        this.rootId = rootId;
    }

    /** New tree holding a single root of {@code rootType} with registry defaults. */
    public static ComponentTree create(ComponentRegistry registry, String rootType,
                                       Supplier<String> idGenerator, Clock clock, int historySize) {
        ComponentDefinition definition = registry.get(rootType)
            .orElseThrow(() -> new TypeNotAllowedException("Unknown component type: " + rootType));
        if (!definition.constraints().canContainChildren()) {
            throw new InvalidParentException("Root component type must accept children: " + rootType);
        }
        String id = idGenerator.get();
        ComponentTree tree = new ComponentTree(registry, idGenerator, clock, historySize, id);
        tree.arena.put(id, new ComponentInstance(id, rootType, null, null,
            definition.defaultProps(), definition.defaultStyles(), null));
        return tree;
    }

    public static ComponentTree create(ComponentRegistry registry, String rootType) {
        return create(registry, rootType, () -> UUID.randomUUID().toString(),
            Clock.systemUTC(), DEFAULT_HISTORY_SIZE);
    }

    /**
     * Rebuilds a tree from stored instances without validating it. Import and
     * recovery paths should call {@link #validateTree()} afterwards.
     */
    public static ComponentTree restore(ComponentRegistry registry, String rootId,
                                        Collection<ComponentInstance> instances,
                                        Supplier<String> idGenerator, Clock clock, int historySize) {
        ComponentTree tree = new ComponentTree(registry, idGenerator, clock, historySize, rootId);
        for (ComponentInstance instance : instances) {
            tree.arena.put(instance.getId(), instance.copy());
        }
        if (!tree.arena.containsKey(rootId)) {
            throw new IllegalArgumentException("Root component missing from stored instances: " + rootId);
        }
        return tree;
    }

    // ── Reads ───────────────────────────────────────────────────────────────

    public String getRootId() {
        return rootId;
    }

    public Optional<ComponentInstance> find(String id) {
        rw.readLock().lock();
        try {
            ComponentInstance instance = arena.get(id);
            return instance == null ? Optional.empty() : Optional.of(instance.copy());
        } finally {
            rw.readLock().unlock();
        }
    }

    public ComponentInstance get(String id) {
        return find(id).orElseThrow(() -> new ComponentNotFoundException(id));
    }

    public int size() {
        rw.readLock().lock();
        try {
            return arena.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    /** Distance from the root, or {@link #UNATTACHED} for a node on a parent cycle. */
    public int depthOf(String id) {
        rw.readLock().lock();
        try {
            if (!arena.containsKey(id)) {
                throw new ComponentNotFoundException(id);
            }
            return depth(id);
        } finally {
            rw.readLock().unlock();
        }
    }

    /** Ordered children of {@code id}, as copies. */
    public List<ComponentInstance> childrenOf(String id) {
        rw.readLock().lock();
        try {
            ComponentInstance node = require(id);
            List<ComponentInstance> result = new ArrayList<>();
            for (String childId : node.mutableChildren()) {
                ComponentInstance child = arena.get(childId);
                if (child != null) result.add(child.copy());
            }
            return result;
        } finally {
            rw.readLock().unlock();
        }
    }

    /** The other children of {@code id}'s parent; empty for the root. */
    public List<ComponentInstance> siblingsOf(String id) {
        rw.readLock().lock();
        try {
            ComponentInstance node = require(id);
            ComponentInstance parent = node.getParentId() == null ? null : arena.get(node.getParentId());
            if (parent == null) return List.of();
            List<ComponentInstance> result = new ArrayList<>();
            for (String childId : parent.mutableChildren()) {
                ComponentInstance sibling = arena.get(childId);
                if (sibling != null && !childId.equals(id)) result.add(sibling.copy());
            }
            return result;
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * Copies of every instance: reachable ones in document (pre-)order from the
     * root, followed by any unreachable ones.
     */
    public List<ComponentInstance> snapshot() {
        rw.readLock().lock();
        try {
            List<ComponentInstance> ordered = new ArrayList<>(arena.size());
            Set<String> seen = new HashSet<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(rootId);
            while (!stack.isEmpty()) {
                String id = stack.pop();
                ComponentInstance node = arena.get(id);
                if (node == null || !seen.add(id)) continue;
                ordered.add(node.copy());
                List<String> children = node.mutableChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
            new TreeMap<>(arena).forEach((id, node) -> {
                if (!seen.contains(id)) ordered.add(node.copy());
            });
            return ordered;
        } finally {
            rw.readLock().unlock();
        }
    }

    public boolean canPlaceInParent(String type, String parentType) {
        return registry.canPlaceInParent(type, parentType);
    }

    public List<HierarchyOperation> history() {
        rw.readLock().lock();
        try {
            return List.copyOf(history);
        } finally {
            rw.readLock().unlock();
        }
    }

    public TreeStatistics statistics() {
        rw.readLock().lock();
        try {
            Map<String, Integer> types = new TreeMap<>();
            int maxDepth = 0;
            for (ComponentInstance node : arena.values()) {
                types.merge(node.getType(), 1, Integer::sum);
                maxDepth = Math.max(maxDepth, depth(node.getId()));
            }
            return new TreeStatistics(arena.size(), maxDepth, types);
        } finally {
            rw.readLock().unlock();
        }
    }

    // ── Mutations ───────────────────────────────────────────────────────────

    /**
     * Creates an instance of {@code type} with registry defaults under
     * {@code parentId}. {@code index} is clamped to {@code [0, children]};
     * {@code null} appends.
     */
    public ComponentInstance insert(String parentId, String type, Integer index) {
        rw.writeLock().lock();
        try {
            ComponentInstance parent = arena.get(parentId);
            if (parent == null) {
                throw new InvalidParentException("Parent component not found: " + parentId);
            }
            checkPlacement(type, parent, null);
            checkDepth(type, attachedDepth(parentId) + 1, inheritedDepthLimit(parentId));
            ComponentDefinition definition = registry.get(type)
                .orElseThrow(() -> new TypeNotAllowedException("Unknown component type: " + type));

            String id = idGenerator.get();
            ComponentInstance created = new ComponentInstance(id, type, parentId, null,
                definition.defaultProps(), definition.defaultStyles(), null);
            int position = clamp(index, parent.mutableChildren().size());
            parent.mutableChildren().add(position, id);
            arena.put(id, created);

            record(HierarchyOperation.Type.ADD, id, parentId, null, position, null);
            log.debug("Inserted {} ({}) under {} at {}", id, type, parentId, position);
            return created.copy();
        } finally {
            rw.writeLock().unlock();
        }
    }

    public ComponentInstance insert(String parentId, String type) {
        return insert(parentId, type, null);
    }

    /**
     * Re-parents {@code instanceId} (with its subtree) under {@code newParentId}.
     * When moving within the same parent, {@code index} addresses the sibling
     * list with the instance already taken out.
     */
    public ComponentInstance move(String instanceId, String newParentId, Integer index) {
        rw.writeLock().lock();
        try {
            ComponentInstance node = require(instanceId);
            ComponentInstance newParent = arena.get(newParentId);
            if (newParent == null) {
                throw new InvalidParentException("Parent component not found: " + newParentId);
            }
            if (isAncestorOrSelf(instanceId, newParentId)) {
                throw new CyclicMoveException(
                    "Cannot move " + instanceId + " into itself or its own descendant " + newParentId);
            }

            checkPlacement(node.getType(), newParent, instanceId);
            checkSubtreeDepth(node, attachedDepth(newParentId) + 1, inheritedDepthLimit(newParentId), new HashSet<>());

            String oldParentId = node.getParentId();
            ComponentInstance oldParent = oldParentId == null ? null : arena.get(oldParentId);
            Integer oldPosition = null;
            if (oldParent != null) {
                oldPosition = oldParent.mutableChildren().indexOf(instanceId);
                oldParent.mutableChildren().remove(instanceId);
            }
            int position = clamp(index, newParent.mutableChildren().size());
            newParent.mutableChildren().add(position, instanceId);
            node.setParentId(newParentId);

            record(HierarchyOperation.Type.MOVE, instanceId, newParentId, oldParentId, position, oldPosition);
            log.debug("Moved {} from {} to {} at {}", instanceId, oldParentId, newParentId, position);
            return node.copy();
        } finally {
            rw.writeLock().unlock();
        }
    }

    /** Deletes the instance and its whole subtree; returns the removed ids, root first. */
    public List<String> remove(String instanceId) {
        rw.writeLock().lock();
        try {
            ComponentInstance node = require(instanceId);
            if (instanceId.equals(rootId)) {
                throw new RootComponentException("The root component cannot be removed");
            }
            List<String> subtree = collectSubtree(instanceId);

            ComponentInstance parent = node.getParentId() == null ? null : arena.get(node.getParentId());
            Integer oldPosition = null;
            if (parent != null) {
                oldPosition = parent.mutableChildren().indexOf(instanceId);
                parent.mutableChildren().remove(instanceId);
            }
            subtree.forEach(arena::remove);

            record(HierarchyOperation.Type.REMOVE, instanceId, null, node.getParentId(), null, oldPosition);
            log.debug("Removed {} and {} descendant(s)", instanceId, subtree.size() - 1);
            return subtree;
        } finally {
            rw.writeLock().unlock();
        }
    }

    /** Deep-copies the subtree with fresh ids, placing the copy right after the original. */
    public ComponentInstance duplicate(String instanceId) {
        rw.writeLock().lock();
        try {
            ComponentInstance node = require(instanceId);
            if (instanceId.equals(rootId)) {
                throw new RootComponentException("The root component cannot be duplicated");
            }
            ComponentInstance parent = arena.get(node.getParentId());
            if (parent == null) {
                throw new InvalidParentException("Parent component not found: " + node.getParentId());
            }
            checkPlacement(node.getType(), parent, null);
            checkSubtreeDepth(node, attachedDepth(parent.getId()) + 1, inheritedDepthLimit(parent.getId()), new HashSet<>());

            Map<String, ComponentInstance> copies = new LinkedHashMap<>();
            String copyId = copySubtree(node, parent.getId(), copies);
            arena.putAll(copies);
            int position = parent.mutableChildren().indexOf(instanceId) + 1;
            parent.mutableChildren().add(position, copyId);

            record(HierarchyOperation.Type.DUPLICATE, copyId, parent.getId(), null, position, null);
            return arena.get(copyId).copy();
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Shallow-merges {@code props} and {@code styles} (a {@code null} value
     * removes the key) and replaces per-breakpoint rules (a {@code null} rule
     * removes the breakpoint). Any argument may be {@code null}.
     */
    public ComponentInstance update(String instanceId,
                                    Map<String, Object> props,
                                    Map<String, Object> styles,
                                    Map<Breakpoint, ResponsiveRule> responsive) {
        rw.writeLock().lock();
        try {
            ComponentInstance node = require(instanceId);
            merge(node.mutableProps(), props);
            merge(node.mutableStyles(), styles);
            if (responsive != null) {
                responsive.forEach((bp, rule) -> {
                    if (rule == null) {
                        node.mutableResponsive().remove(bp);
                    } else {
                        node.mutableResponsive().put(bp, rule);
                    }
                });
            }
            record(HierarchyOperation.Type.UPDATE, instanceId, node.getParentId(), null, null, null);
            return node.copy();
        } finally {
            rw.writeLock().unlock();
        }
    }

    // ── Integrity sweep ─────────────────────────────────────────────────────

    /** Full-tree sweep; an empty list means the tree satisfies every constraint. */
    public List<TreeViolation> validateTree() {
        rw.readLock().lock();
        try {
            List<TreeViolation> violations = new ArrayList<>();
            Set<String> reached = new HashSet<>();
            ComponentInstance root = arena.get(rootId);
            if (root.getParentId() != null) {
                violations.add(new TreeViolation(TreeViolation.Kind.ORPHAN, rootId,
                    "Root component declares a parent: " + root.getParentId()));
            }
            sweep(root, 0, Integer.MAX_VALUE, new HashSet<>(), reached, violations);

            new TreeMap<>(arena).keySet().stream()
                .filter(id -> !reached.contains(id))
                .forEach(id -> violations.add(depth(id) == UNATTACHED
                    ? new TreeViolation(TreeViolation.Kind.CYCLE, id, "Component sits on a parent cycle")
                    : new TreeViolation(TreeViolation.Kind.ORPHAN, id, "Component is not reachable from the root")));
            return violations;
        } finally {
            rw.readLock().unlock();
        }
    }

    private void sweep(ComponentInstance node, int depth, int inheritedLimit,
                       Set<String> path, Set<String> reached, List<TreeViolation> violations) {
        reached.add(node.getId());
        path.add(node.getId());

        Optional<ComponentDefinition> definition = registry.get(node.getType());
        if (definition.isEmpty()) {
            violations.add(new TreeViolation(TreeViolation.Kind.UNKNOWN_TYPE, node.getId(),
                "Unknown component type: " + node.getType()));
        }
        PlacementConstraints own = registry.getConstraints(node.getType());
        int limit = own.maxDepth() == null ? inheritedLimit : Math.min(inheritedLimit, own.maxDepth());
        if (depth > limit) {
            violations.add(new TreeViolation(TreeViolation.Kind.DEPTH_EXCEEDED, node.getId(),
                node.getType() + " at depth " + depth + " exceeds limit " + limit));
        }

        List<String> children = node.mutableChildren();
        if (!children.isEmpty() && !own.canContainChildren()) {
            violations.add(new TreeViolation(TreeViolation.Kind.INVALID_PARENT, node.getId(),
                node.getType() + " cannot contain children"));
        }
        if (own.maxChildren() != null && children.size() > own.maxChildren()) {
            violations.add(new TreeViolation(TreeViolation.Kind.CHILD_LIMIT_EXCEEDED, node.getId(),
                node.getType() + " has " + children.size() + " children, limit is " + own.maxChildren()));
        }

        for (String childId : children) {
            ComponentInstance child = arena.get(childId);
            if (child == null) {
                violations.add(new TreeViolation(TreeViolation.Kind.DANGLING_CHILD, node.getId(),
                    "Child reference points to a missing component: " + childId));
                continue;
            }
            if (path.contains(childId)) {
                violations.add(new TreeViolation(TreeViolation.Kind.CYCLE, childId,
                    "Component is its own ancestor via " + node.getId()));
                continue;
            }
            if (reached.contains(childId)) {
                violations.add(new TreeViolation(TreeViolation.Kind.DUPLICATE_CHILD, childId,
                    "Component is listed as a child more than once"));
                continue;
            }
            if (!node.getId().equals(child.getParentId())) {
                violations.add(new TreeViolation(TreeViolation.Kind.ORPHAN, childId,
                    "Listed under " + node.getId() + " but parentId is " + child.getParentId()));
            }
            if (!own.acceptsChild(child.getType())
                || !registry.getConstraints(child.getType()).acceptsParent(node.getType())) {
                violations.add(new TreeViolation(TreeViolation.Kind.TYPE_NOT_ALLOWED, childId,
                    child.getType() + " is not allowed inside " + node.getType()));
            }
            sweep(child, depth + 1, limit, path, reached, violations);
        }
        path.remove(node.getId());
    }

    // ── Internals (callers hold the lock) ───────────────────────────────────

    private ComponentInstance require(String id) {
        ComponentInstance node = id == null ? null : arena.get(id);
        if (node == null) {
            throw new ComponentNotFoundException(id);
        }
        return node;
    }

    private void checkPlacement(String childType, ComponentInstance parent, String movingId) {
        PlacementConstraints parentRules = registry.getConstraints(parent.getType());
        if (!parentRules.canContainChildren()) {
            throw new InvalidParentException(parent.getType() + " cannot contain children");
        }
        if (!parentRules.acceptsChild(childType)) {
            throw new TypeNotAllowedException(parent.getType() + " does not accept " + childType + " children");
        }
        if (!registry.getConstraints(childType).acceptsParent(parent.getType())) {
            throw new TypeNotAllowedException(childType + " cannot be placed inside " + parent.getType());
        }
        if (parentRules.maxChildren() != null) {
            int count = parent.mutableChildren().size();
            if (movingId != null && parent.mutableChildren().contains(movingId)) {
                count--;
            }
            if (count >= parentRules.maxChildren()) {
                throw new ChildLimitExceededException(
                    parent.getType() + " already holds the maximum of " + parentRules.maxChildren() + " children");
            }
        }
    }

    private void checkDepth(String type, int depth, int inheritedLimit) {
        Integer own = registry.getConstraints(type).maxDepth();
        int limit = own == null ? inheritedLimit : Math.min(inheritedLimit, own);
        if (depth > limit) {
            throw new DepthExceededException(type + " would sit at depth " + depth + ", limit is " + limit);
        }
    }

    private void checkSubtreeDepth(ComponentInstance node, int depth, int inheritedLimit, Set<String> visited) {
        if (!visited.add(node.getId())) return;
        Integer own = registry.getConstraints(node.getType()).maxDepth();
        int limit = own == null ? inheritedLimit : Math.min(inheritedLimit, own);
        if (depth > limit) {
            throw new DepthExceededException(
                node.getType() + " " + node.getId() + " would sit at depth " + depth + ", limit is " + limit);
        }
        for (String childId : node.mutableChildren()) {
            ComponentInstance child = arena.get(childId);
            if (child != null) {
                checkSubtreeDepth(child, depth + 1, limit, visited);
            }
        }
    }

    /** Smallest maxDepth declared by {@code id} or any of its ancestors. */
    private int inheritedDepthLimit(String id) {
        int limit = Integer.MAX_VALUE;
        String current = id;
        int guard = arena.size();
        while (current != null && guard-- >= 0) {
            ComponentInstance node = arena.get(current);
            if (node == null) break;
            Integer declared = registry.getConstraints(node.getType()).maxDepth();
            if (declared != null) {
                limit = Math.min(limit, declared);
            }
            current = node.getParentId();
        }
        return limit;
    }

    /** Length of the parent chain, or {@link #UNATTACHED} when the chain loops. */
    private int depth(String id) {
        int depth = 0;
        ComponentInstance node = arena.get(id);
        int guard = arena.size();
        while (node != null && node.getParentId() != null) {
            if (guard-- <= 0) {
                return UNATTACHED;
            }
            depth++;
            node = arena.get(node.getParentId());
        }
        return depth;
    }

    private int attachedDepth(String parentId) {
        int depth = depth(parentId);
        if (depth == UNATTACHED) {
            throw new InvalidParentException("Parent " + parentId + " sits on a parent cycle and is not attached to the root");
        }
        return depth;
    }

    private boolean isAncestorOrSelf(String candidateAncestor, String id) {
        String current = id;
        int guard = arena.size();
        while (current != null && guard-- >= 0) {
            if (current.equals(candidateAncestor)) return true;
            ComponentInstance node = arena.get(current);
            current = node == null ? null : node.getParentId();
        }
        return false;
    }

    private List<String> collectSubtree(String id) {
        List<String> collected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(id);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!seen.add(current)) continue;
            collected.add(current);
            ComponentInstance node = arena.get(current);
            if (node == null) continue;
            List<String> children = node.mutableChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return collected;
    }

    private String copySubtree(ComponentInstance source, String newParentId, Map<String, ComponentInstance> out) {
        String newId = idGenerator.get();
        ComponentInstance copy = new ComponentInstance(newId, source.getType(), newParentId, null,
            source.mutableProps(), source.mutableStyles(), source.mutableResponsive());
        out.put(newId, copy);
        for (String childId : source.mutableChildren()) {
            ComponentInstance child = arena.get(childId);
            if (child != null) {
                copy.mutableChildren().add(copySubtree(child, newId, out));
            }
        }
        return newId;
    }

    private static void merge(Map<String, Object> target, Map<String, Object> patch) {
        if (patch == null) return;
        patch.forEach((key, value) -> {
            if (value == null) {
                target.remove(key);
            } else {
                target.put(key, NestedValues.copyValue(value));
            }
        });
    }

    private static int clamp(Integer index, int size) {
        if (index == null) return size;
        return Math.max(0, Math.min(index, size));
    }

    private void record(HierarchyOperation.Type type, String componentId, String parentId,
                        String oldParentId, Integer position, Integer oldPosition) {
        history.addLast(new HierarchyOperation(type, componentId, parentId, oldParentId,
            position, oldPosition, clock.instant()));
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }
}
