package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Serdeable
@Schema(description = "Request to create a page design")
public record CreateDesignRequest(
    @NotBlank
    @Size(max = 200)
    @Schema(description = "Design name", example = "Landing page")
    String name
) {}
