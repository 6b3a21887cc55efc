package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Serdeable
@Schema(description = "Page design with its component tree in document order")
public record PageDesignResponse(
    UUID id,
    String name,
    String ownerId,
    String rootId,
    String lockResourceId,
    List<ComponentResponse> components,
    boolean unsavedChanges,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
