package com.pagecraft.controller;

import com.pagecraft.dto.PlacementCheckResponse;
import com.pagecraft.service.registry.ComponentDefinition;
import com.pagecraft.service.registry.ComponentRegistry;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.http.exceptions.HttpStatusException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;

import java.util.List;

@Controller("/api/v1/components")
@Tag(name = "components")
public class ComponentRegistryController {

    @Inject
    ComponentRegistry registry;

    @Get
    @Operation(summary = "List registered component types, optionally by category or search term")
    public HttpResponse<List<ComponentDefinition>> list(@Nullable @QueryValue String category,
                                                        @Nullable @QueryValue String q) {
        if (q != null && !q.isBlank()) {
            return HttpResponse.ok(registry.search(q));
        }
        if (category != null && !category.isBlank()) {
            return HttpResponse.ok(registry.listByCategory(category));
        }
        return HttpResponse.ok(registry.list());
    }

    @Get("/{type}")
    @Operation(summary = "Get a component definition")
    public HttpResponse<ComponentDefinition> get(String type) {
        return HttpResponse.ok(registry.get(type)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND,
                "Component type not found: " + type)));
    }

    @Get("/{type}/placement")
    @Operation(summary = "Check whether a type may be placed under a parent type")
    public HttpResponse<PlacementCheckResponse> placement(String type, @QueryValue String parentType) {
        return HttpResponse.ok(new PlacementCheckResponse(type, parentType,
            registry.canPlaceInParent(type, parentType)));
    }
}
