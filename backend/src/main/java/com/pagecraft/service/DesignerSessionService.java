package com.pagecraft.service;

import com.pagecraft.domain.Breakpoint;
import com.pagecraft.domain.PageDesign;
import com.pagecraft.dto.ComponentResponse;
import com.pagecraft.dto.CreateDesignRequest;
import com.pagecraft.dto.InsertComponentRequest;
import com.pagecraft.dto.MoveComponentRequest;
import com.pagecraft.dto.PageDesignResponse;
import com.pagecraft.dto.ResponsiveReportResponse;
import com.pagecraft.dto.TreeValidationResponse;
import com.pagecraft.dto.UpdateComponentRequest;
import com.pagecraft.repository.PageDesignRepository;
import com.pagecraft.service.lock.ResourceLockManager;
import com.pagecraft.service.registry.ComponentRegistry;
import com.pagecraft.service.responsive.CascadeOrder;
import com.pagecraft.service.responsive.ResolvedComponent;
import com.pagecraft.service.responsive.ResponsiveResolver;
import com.pagecraft.service.tree.ComponentInstance;
import com.pagecraft.service.tree.ComponentTree;
import com.pagecraft.service.tree.HierarchyOperation;
import com.pagecraft.service.tree.ResponsiveRule;
import com.pagecraft.service.tree.TreeConfiguration;
import com.pagecraft.service.tree.TreeStatistics;
import com.pagecraft.service.tree.TreeViolation;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-design editing session: keeps each design's tree in memory, gates
 * structural edits on the design's resource lock and queues the design for
 * a debounced write after every successful edit.
 *
 * Lock resource for a design: {@code page-design:{id}}.
 */
@Singleton
public class DesignerSessionService {

    private static final Logger log = LoggerFactory.getLogger(DesignerSessionService.class);
    static final String LOCK_PREFIX = "page-design:";

    private static final Supplier<String> ID_GENERATOR = () -> UUID.randomUUID().toString();

    @Inject PageDesignRepository designRepository;
    @Inject ComponentRegistry registry;
    @Inject ResourceLockManager lockManager;
    @Inject ResponsiveResolver resolver;
    @Inject TreeJsonCodec codec;
    @Inject AutosaveQueue autosaveQueue;
    @Inject TreeConfiguration treeConfig;
    @Inject Clock clock;

    private final Map<UUID, ComponentTree> trees = new ConcurrentHashMap<>();

    public static String lockResourceId(UUID designId) {
        return LOCK_PREFIX + designId;
    }

    // ── Designs ─────────────────────────────────────────────────────────────

    @Transactional
    public PageDesignResponse create(CreateDesignRequest req, String ownerId) {
        ComponentTree tree = ComponentTree.create(registry, treeConfig.getRootType(), ID_GENERATOR,
            clock, treeConfig.getHistorySize());

        PageDesign design = new PageDesign(req.name(), ownerId);
        design.setRootId(tree.getRootId());
        design.setTreeJson(codec.encode(tree));
        design = designRepository.save(design);
        trees.put(design.getId(), tree);

        log.info("Design created: id={} name={} owner={}", design.getId(), req.name(), ownerId);
        return toResponse(design, tree);
    }

    public List<PageDesignResponse> listAll() {
        return designRepository.findAll()
            .stream()
            .map(d -> toResponse(d, tree(d)))
            .toList();
    }

    public List<PageDesignResponse> listByOwner(String ownerId) {
        return designRepository.findByOwnerId(ownerId)
            .stream()
            .map(d -> toResponse(d, tree(d)))
            .toList();
    }

    public PageDesignResponse getById(UUID designId) {
        PageDesign design = findDesign(designId);
        return toResponse(design, tree(design));
    }

    /** Writes the in-memory tree now, regardless of the debounce window. */
    public PageDesignResponse save(UUID designId) {
        ComponentTree tree = tree(designId);
        autosaveQueue.clear(designId);
        PageDesign design = write(designId, tree);
        log.info("Design saved: id={} components={}", designId, tree.size());
        return toResponse(design, tree);
    }

    // ── Structural edits (lock required) ────────────────────────────────────

    public ComponentResponse insert(UUID designId, String holderId, InsertComponentRequest req) {
        ComponentTree tree = lockedTree(designId, holderId);
        ComponentInstance created = tree.insert(req.parentId(), req.type(), req.index());
        edited(designId);
        return toResponse(tree, created);
    }

    public ComponentResponse move(UUID designId, String holderId, String componentId, MoveComponentRequest req) {
        ComponentTree tree = lockedTree(designId, holderId);
        ComponentInstance moved = tree.move(componentId, req.newParentId(), req.index());
        edited(designId);
        return toResponse(tree, moved);
    }

    public ComponentResponse update(UUID designId, String holderId, String componentId, UpdateComponentRequest req) {
        ComponentTree tree = lockedTree(designId, holderId);
        Map<Breakpoint, ResponsiveRule> responsive = null;
        if (req.responsive() != null) {
            responsive = new EnumMap<>(Breakpoint.class);
            for (Map.Entry<String, ResponsiveRule> entry : req.responsive().entrySet()) {
                responsive.put(Breakpoint.of(entry.getKey()), entry.getValue());
            }
        }
        ComponentInstance updated = tree.update(componentId, req.props(), req.styles(), responsive);
        edited(designId);
        return toResponse(tree, updated);
    }

    public ComponentResponse duplicate(UUID designId, String holderId, String componentId) {
        ComponentTree tree = lockedTree(designId, holderId);
        ComponentInstance copy = tree.duplicate(componentId);
        edited(designId);
        return toResponse(tree, copy);
    }

    public List<String> remove(UUID designId, String holderId, String componentId) {
        ComponentTree tree = lockedTree(designId, holderId);
        List<String> removed = tree.remove(componentId);
        edited(designId);
        return removed;
    }

    // ── Reads ───────────────────────────────────────────────────────────────

    public ComponentResponse getComponent(UUID designId, String componentId) {
        ComponentTree tree = tree(designId);
        return toResponse(tree, tree.get(componentId));
    }

    public TreeValidationResponse validate(UUID designId) {
        List<TreeViolation> violations = tree(designId).validateTree();
        return new TreeValidationResponse(violations.isEmpty(), violations);
    }

    public TreeStatistics statistics(UUID designId) {
        return tree(designId).statistics();
    }

    public List<HierarchyOperation> history(UUID designId) {
        return tree(designId).history();
    }

    public ResolvedComponent resolve(UUID designId, String componentId, Breakpoint breakpoint, CascadeOrder order) {
        ComponentInstance instance = tree(designId).get(componentId);
        return resolver.resolve(instance, breakpoint, order != null ? order : resolver.defaultOrder());
    }

    public ResponsiveReportResponse responsiveReport(UUID designId, String componentId) {
        ComponentTree tree = tree(designId);
        ComponentInstance instance = tree.get(componentId);
        return new ResponsiveReportResponse(componentId,
            resolver.validateResponsiveConfig(instance, tree.siblingsOf(componentId)),
            resolver.suggestOptimizations(instance));
    }

    // ── Autosave ────────────────────────────────────────────────────────────

    @Scheduled(fixedDelay = "${designer.autosave.interval:1s}")
    void flushDue() {
        for (UUID designId : autosaveQueue.drainDue()) {
            try {
                write(designId, tree(designId));
                log.debug("Autosaved design {}", designId);
            } catch (Exception e) {
                log.warn("Autosave failed for design {}: {}", designId, e.getMessage());
                autosaveQueue.markDirty(designId);
            }
        }
    }

    // ── Internals ───────────────────────────────────────────────────────────

    private ComponentTree lockedTree(UUID designId, String holderId) {
        ComponentTree tree = tree(designId);
        lockManager.verifyHolder(lockResourceId(designId), holderId);
        return tree;
    }

    private void edited(UUID designId) {
        autosaveQueue.markDirty(designId);
    }

    // Serialized per tree: save() and the autosave flush both bump the version.
    private PageDesign write(UUID designId, ComponentTree tree) {
        synchronized (tree) {
            PageDesign design = findDesign(designId);
            design.setRootId(tree.getRootId());
            design.setTreeJson(codec.encode(tree));
            return designRepository.update(design);
        }
    }

    private PageDesign findDesign(UUID designId) {
        return designRepository.findById(designId)
            .orElseThrow(() -> new DesignNotFoundException(designId));
    }

    private ComponentTree tree(UUID designId) {
        ComponentTree cached = trees.get(designId);
        if (cached != null) {
            return cached;
        }
        return tree(findDesign(designId));
    }

    private ComponentTree tree(PageDesign design) {
        return trees.computeIfAbsent(design.getId(), id -> {
            ComponentTree loaded = codec.restore(design.getTreeJson(), registry, ID_GENERATOR,
                clock, treeConfig.getHistorySize());
            List<TreeViolation> violations = loaded.validateTree();
            if (!violations.isEmpty()) {
                log.warn("Design {} loaded with {} tree violation(s), first: {}",
                    id, violations.size(), violations.get(0).message());
            }
            return loaded;
        });
    }

    private PageDesignResponse toResponse(PageDesign design, ComponentTree tree) {
        List<ComponentResponse> components = tree.snapshot().stream()
            .map(c -> toResponse(tree, c))
            .toList();
        return new PageDesignResponse(
            design.getId(),
            design.getName(),
            design.getOwnerId(),
            tree.getRootId(),
            lockResourceId(design.getId()),
            components,
            autosaveQueue.isDirty(design.getId()),
            design.getCreatedAt(),
            design.getUpdatedAt()
        );
    }

    private ComponentResponse toResponse(ComponentTree tree, ComponentInstance c) {
        Map<String, ResponsiveRule> responsive = new LinkedHashMap<>();
        c.getResponsive().forEach((bp, rule) -> responsive.put(bp.key(), rule));
        return new ComponentResponse(
            c.getId(),
            c.getType(),
            c.getParentId(),
            c.getChildren(),
            c.getProps(),
            c.getStyles(),
            responsive,
            tree.depthOf(c.getId())
        );
    }
}
