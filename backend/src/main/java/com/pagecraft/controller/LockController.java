package com.pagecraft.controller;

import com.pagecraft.dto.AcquireLockRequest;
import com.pagecraft.dto.ExtendLockRequest;
import com.pagecraft.dto.ResourceLockResponse;
import com.pagecraft.infra.UserHeaderFilter;
import com.pagecraft.service.lock.LockNotFoundException;
import com.pagecraft.service.lock.LockType;
import com.pagecraft.service.lock.ResourceLock;
import com.pagecraft.service.lock.ResourceLockManager;
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

@Controller("/api/v1/locks")
@Validated
@Tag(name = "locks")
public class LockController {

    @Inject
    ResourceLockManager lockManager;

    @Post("/{resourceId}")
    @Operation(summary = "Acquire, refresh or reclaim a resource lock")
    public HttpResponse<ResourceLockResponse> acquire(String resourceId,
                                                      @Header(UserHeaderFilter.HEADER) String userId,
                                                      @Valid @Body AcquireLockRequest req) {
        LockType type = req.lockType() != null ? LockType.of(req.lockType()) : null;
        ResourceLock lock = lockManager.acquire(resourceId, userId, type, req.durationMinutes(), req.reason());
        return HttpResponse.status(HttpStatus.CREATED).body(toResponse(lock, userId));
    }

    @Get
    @Operation(summary = "List active locks")
    public HttpResponse<List<ResourceLockResponse>> list(@Nullable @QueryValue String resourceId,
                                                         @Header(UserHeaderFilter.HEADER) String userId) {
        return HttpResponse.ok(lockManager.listActive(resourceId).stream()
            .map(l -> toResponse(l, userId))
            .toList());
    }

    @Get("/{resourceId}")
    @Operation(summary = "Get the active lock on a resource")
    public HttpResponse<ResourceLockResponse> get(String resourceId,
                                                  @Header(UserHeaderFilter.HEADER) String userId) {
        ResourceLock lock = lockManager.findActive(resourceId)
            .orElseThrow(() -> new LockNotFoundException(resourceId));
        return HttpResponse.ok(toResponse(lock, userId));
    }

    @Delete("/{resourceId}")
    @Operation(summary = "Release a lock")
    public HttpResponse<Void> release(String resourceId, @QueryValue String token) {
        lockManager.release(resourceId, token);
        return HttpResponse.noContent();
    }

    @Post("/{resourceId}/extend")
    @Operation(summary = "Extend a held lock")
    public HttpResponse<ResourceLockResponse> extend(String resourceId,
                                                     @Header(UserHeaderFilter.HEADER) String userId,
                                                     @Valid @Body ExtendLockRequest req) {
        ResourceLock lock = lockManager.extend(resourceId, req.token(), req.additionalMinutes());
        return HttpResponse.ok(toResponse(lock, userId));
    }

    private ResourceLockResponse toResponse(ResourceLock l, String callerId) {
        return new ResourceLockResponse(
            l.resourceId(),
            l.holderId(),
            l.holderId().equals(callerId) ? l.token() : null,
            l.lockType().value(),
            l.acquiredAt(),
            l.expiresAt(),
            l.reason(),
            lockManager.isRenewalDue(l)
        );
    }
}
