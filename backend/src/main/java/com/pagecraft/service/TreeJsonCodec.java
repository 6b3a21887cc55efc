package com.pagecraft.service;

import com.pagecraft.domain.Breakpoint;
import com.pagecraft.service.registry.ComponentRegistry;
import com.pagecraft.service.tree.ComponentInstance;
import com.pagecraft.service.tree.ComponentTree;
import com.pagecraft.service.tree.ResponsiveRule;
import io.micronaut.json.JsonMapper;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/** Converts component trees to and from the JSON document kept on {@code page_designs}. */
@Singleton
public class TreeJsonCodec {

    private final JsonMapper jsonMapper;

    public TreeJsonCodec(JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    public String encode(ComponentTree tree) {
        List<TreeSnapshot.Node> nodes = tree.snapshot().stream()
            .map(TreeJsonCodec::toNode)
            .toList();
        try {
            return jsonMapper.writeValueAsString(new TreeSnapshot(tree.getRootId(), nodes));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not serialize component tree " + tree.getRootId(), e);
        }
    }

    public TreeSnapshot decode(String json) {
        try {
            return jsonMapper.readValue(json, TreeSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not parse stored component tree", e);
        }
    }

    public ComponentTree restore(String json, ComponentRegistry registry, Supplier<String> idGenerator,
                                 Clock clock, int historySize) {
        TreeSnapshot snapshot = decode(json);
        List<ComponentInstance> instances = snapshot.components().stream()
            .map(TreeJsonCodec::toInstance)
            .toList();
        return ComponentTree.restore(registry, snapshot.rootId(), instances, idGenerator, clock, historySize);
    }

    static TreeSnapshot.Node toNode(ComponentInstance instance) {
        Map<String, ResponsiveRule> responsive = new LinkedHashMap<>();
        instance.getResponsive().forEach((bp, rule) -> responsive.put(bp.key(), rule));
        return new TreeSnapshot.Node(instance.getId(), instance.getType(), instance.getParentId(),
            instance.getChildren(), instance.getProps(), instance.getStyles(), responsive);
    }

    static ComponentInstance toInstance(TreeSnapshot.Node node) {
        Map<Breakpoint, ResponsiveRule> responsive = new EnumMap<>(Breakpoint.class);
        if (node.responsive() != null) {
            node.responsive().forEach((key, rule) -> responsive.put(Breakpoint.of(key), rule));
        }
        return new ComponentInstance(node.id(), node.type(), node.parentId(), node.children(),
            node.props(), node.styles(), responsive);
    }
}
