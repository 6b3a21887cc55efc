package com.pagecraft.service.registry;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type name → {@link ComponentDefinition} lookup used by every tree mutation.
 *
 * Populated with {@link DefaultComponents} on construction. Registration is
 * configuration, expected at startup; later registrations overwrite.
 */
@Singleton
public class ComponentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final Map<String, ComponentDefinition> definitions = new ConcurrentHashMap<>();

    @Inject
    public ComponentRegistry() {
        this(DefaultComponents.all());
    }

    public ComponentRegistry(Collection<ComponentDefinition> initial) {
        initial.forEach(this::register);
    }

    public void register(ComponentDefinition definition) {
        ComponentDefinition previous = definitions.put(definition.type(), definition);
        if (previous != null) {
            log.info("Component definition overwritten: type={}", definition.type());
        } else {
            log.debug("Component definition registered: type={}", definition.type());
        }
    }

    public Optional<ComponentDefinition> get(String type) {
        if (type == null) return Optional.empty();
        return Optional.ofNullable(definitions.get(type));
    }

    public boolean contains(String type) {
        return type != null && definitions.containsKey(type);
    }

    /** Unknown types are unrestricted. */
    public PlacementConstraints getConstraints(String type) {
        return get(type)
            .map(ComponentDefinition::constraints)
            .orElse(PlacementConstraints.UNRESTRICTED);
    }

    /**
     * Pure placement query for drag-and-drop feedback: checks the child's
     * allowed parents and the parent's own container rules. Depth and child
     * limits need a concrete tree and are checked on insert/move.
     */
    public boolean canPlaceInParent(String type, String parentType) {
        PlacementConstraints parent = getConstraints(parentType);
        if (!parent.canContainChildren()) return false;
        if (!parent.acceptsChild(type)) return false;
        return getConstraints(type).acceptsParent(parentType);
    }

    public List<ComponentDefinition> list() {
        return definitions.values().stream()
            .sorted(Comparator.comparing(ComponentDefinition::category)
                .thenComparing(ComponentDefinition::type))
            .toList();
    }

    public List<ComponentDefinition> listByCategory(String category) {
        return list().stream()
            .filter(d -> d.category().equalsIgnoreCase(category))
            .toList();
    }

    public List<ComponentDefinition> search(String query) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        return list().stream()
            .filter(d -> d.name().toLowerCase(Locale.ROOT).contains(q)
                || (d.description() != null && d.description().toLowerCase(Locale.ROOT).contains(q)))
            .toList();
    }
}
