package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.time.Instant;

@Serdeable
@Schema(description = "Resource lock details")
public record ResourceLockResponse(
    String resourceId,
    String holderId,
    @Nullable
    @Schema(description = "Only returned to the lock's holder")
    String token,
    String lockType,
    Instant acquiredAt,
    Instant expiresAt,
    @Nullable String reason,
    boolean renewalDue
) {}
