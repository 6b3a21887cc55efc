package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "Request to insert a new component")
public record InsertComponentRequest(
    @NotBlank String parentId,
    @NotBlank String type,
    @Nullable
    @Schema(description = "Position among the parent's children; clamped, appended when absent")
    Integer index
) {}
