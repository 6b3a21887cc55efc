package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

@Serdeable
@Schema(description = "Request to acquire a resource lock")
public record AcquireLockRequest(
    @Nullable
    @Schema(description = "Lock type", allowableValues = {"schema_edit", "field_edit", "critical"},
            defaultValue = "field_edit")
    String lockType,

    @Nullable
    @Schema(description = "Lock duration in minutes (defaults to the lock type's duration)", maximum = "480")
    Integer durationMinutes,

    @Nullable
    @Schema(description = "Why the lock is needed", maxLength = 200)
    String reason
) {}
