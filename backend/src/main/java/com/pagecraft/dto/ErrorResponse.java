package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.Map;

@Serdeable
@Schema(description = "Error response")
public record ErrorResponse(
    String message,
    @Nullable String code,
    @Nullable Map<String, Object> details
) {}
