package com.pagecraft.controller;

import com.pagecraft.domain.Breakpoint;
import com.pagecraft.domain.DevicePreview;
import com.pagecraft.dto.*;
import com.pagecraft.infra.UserHeaderFilter;
import com.pagecraft.service.DesignerSessionService;
import com.pagecraft.service.responsive.CascadeOrder;
import com.pagecraft.service.responsive.ResolvedComponent;
import com.pagecraft.service.tree.HierarchyOperation;
import com.pagecraft.service.tree.TreeStatistics;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Page designs and their component trees. Structural edits require the caller
 * to hold the design's lock ({@code page-design:{id}}, see /api/v1/locks).
 */
@Controller("/api/v1/designs")
@Validated
@Tag(name = "designs")
public class DesignController {

    @Inject
    DesignerSessionService sessionService;

    @Post
    @Operation(summary = "Create a page design with an empty root container")
    public HttpResponse<PageDesignResponse> create(@Header(UserHeaderFilter.HEADER) String userId,
                                                   @Valid @Body CreateDesignRequest req) {
        return HttpResponse.created(sessionService.create(req, userId));
    }

    @Get
    @Operation(summary = "List page designs, optionally for one owner")
    public HttpResponse<List<PageDesignResponse>> list(@Nullable @QueryValue String ownerId) {
        return HttpResponse.ok(ownerId != null ? sessionService.listByOwner(ownerId) : sessionService.listAll());
    }

    @Get("/{id}")
    @Operation(summary = "Get a page design with its component tree")
    public HttpResponse<PageDesignResponse> get(UUID id) {
        return HttpResponse.ok(sessionService.getById(id));
    }

    @Post("/{id}/save")
    @Operation(summary = "Write pending edits now")
    public HttpResponse<PageDesignResponse> save(UUID id) {
        return HttpResponse.ok(sessionService.save(id));
    }

    // ── Components ─────────────────────────────────────────────────────────

    @Post("/{id}/components")
    @Operation(summary = "Insert a component")
    public HttpResponse<ComponentResponse> insert(UUID id,
                                                  @Header(UserHeaderFilter.HEADER) String userId,
                                                  @Valid @Body InsertComponentRequest req) {
        return HttpResponse.status(HttpStatus.CREATED).body(sessionService.insert(id, userId, req));
    }

    @Get("/{id}/components/{componentId}")
    @Operation(summary = "Get a component")
    public HttpResponse<ComponentResponse> getComponent(UUID id, String componentId) {
        return HttpResponse.ok(sessionService.getComponent(id, componentId));
    }

    @Post("/{id}/components/{componentId}/move")
    @Operation(summary = "Move a component under a new parent")
    public HttpResponse<ComponentResponse> move(UUID id, String componentId,
                                                @Header(UserHeaderFilter.HEADER) String userId,
                                                @Valid @Body MoveComponentRequest req) {
        return HttpResponse.ok(sessionService.move(id, userId, componentId, req));
    }

    @Patch("/{id}/components/{componentId}")
    @Operation(summary = "Update a component's props, styles or responsive rules")
    public HttpResponse<ComponentResponse> update(UUID id, String componentId,
                                                  @Header(UserHeaderFilter.HEADER) String userId,
                                                  @Body UpdateComponentRequest req) {
        return HttpResponse.ok(sessionService.update(id, userId, componentId, req));
    }

    @Post("/{id}/components/{componentId}/duplicate")
    @Operation(summary = "Duplicate a component and its subtree")
    public HttpResponse<ComponentResponse> duplicate(UUID id, String componentId,
                                                     @Header(UserHeaderFilter.HEADER) String userId) {
        return HttpResponse.status(HttpStatus.CREATED).body(sessionService.duplicate(id, userId, componentId));
    }

    @Delete("/{id}/components/{componentId}")
    @Operation(summary = "Remove a component and its subtree")
    public HttpResponse<List<String>> remove(UUID id, String componentId,
                                             @Header(UserHeaderFilter.HEADER) String userId) {
        return HttpResponse.ok(sessionService.remove(id, userId, componentId));
    }

    // ── Tree and responsive queries ────────────────────────────────────────

    @Get("/{id}/validation")
    @Operation(summary = "Run the full tree integrity sweep")
    public HttpResponse<TreeValidationResponse> validate(UUID id) {
        return HttpResponse.ok(sessionService.validate(id));
    }

    @Get("/{id}/statistics")
    @Operation(summary = "Component counts and depth")
    public HttpResponse<TreeStatistics> statistics(UUID id) {
        return HttpResponse.ok(sessionService.statistics(id));
    }

    @Get("/{id}/history")
    @Operation(summary = "Recent structural operations")
    public HttpResponse<List<HierarchyOperation>> history(UUID id) {
        return HttpResponse.ok(sessionService.history(id));
    }

    @Get("/{id}/components/{componentId}/resolved")
    @Operation(summary = "Effective props and styles at a breakpoint, viewport width or device preset")
    public HttpResponse<ResolvedComponent> resolved(UUID id, String componentId,
                                                    @Nullable @QueryValue String breakpoint,
                                                    @Nullable @QueryValue Integer width,
                                                    @Nullable @QueryValue String device,
                                                    @Nullable @QueryValue String order) {
        Breakpoint bp;
        if (breakpoint != null) {
            bp = Breakpoint.of(breakpoint);
        } else if (width != null) {
            bp = Breakpoint.forWidth(width);
        } else if (device != null) {
            bp = DevicePreview.fromKey(device)
                .orElseThrow(() -> new IllegalArgumentException("Unknown device preview: " + device))
                .breakpoint();
        } else {
            bp = Breakpoint.XS;
        }
        CascadeOrder cascade = order != null ? CascadeOrder.valueOf(order.toUpperCase(Locale.ROOT)) : null;
        return HttpResponse.ok(sessionService.resolve(id, componentId, bp, cascade));
    }

    @Get("/{id}/components/{componentId}/conflicts")
    @Operation(summary = "Responsive authoring conflicts and suggestions")
    public HttpResponse<ResponsiveReportResponse> conflicts(UUID id, String componentId) {
        return HttpResponse.ok(sessionService.responsiveReport(id, componentId));
    }
}
