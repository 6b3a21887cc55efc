package com.pagecraft.dto;

import io.micronaut.serde.annotation.Serdeable;

@Serdeable
public record PlacementCheckResponse(String type, String parentType, boolean allowed) {}
