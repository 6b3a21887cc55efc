package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "Request to extend a held lock")
public record ExtendLockRequest(
    @NotBlank
    @Schema(description = "Token returned when the lock was acquired")
    String token,

    @Schema(description = "Minutes to add", minimum = "1", maximum = "120")
    int additionalMinutes
) {}
