package com.pagecraft.dto;

import com.pagecraft.service.responsive.ResponsiveConflict;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Serdeable
@Schema(description = "Advisory responsive checks for one component")
public record ResponsiveReportResponse(
    String componentId,
    List<ResponsiveConflict> conflicts,
    List<String> suggestions
) {}
