package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;

@Serdeable
@Schema(description = "Request to move a component under a new parent")
public record MoveComponentRequest(
    @NotBlank String newParentId,
    @Nullable
    @Schema(description = "Position among the new parent's children, counted without the moved component")
    Integer index
) {}
