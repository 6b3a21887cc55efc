package com.pagecraft.dto;

import com.pagecraft.service.tree.TreeViolation;
import io.micronaut.serde.annotation.Serdeable;

import java.util.List;

@Serdeable
public record TreeValidationResponse(boolean valid, List<TreeViolation> violations) {}
