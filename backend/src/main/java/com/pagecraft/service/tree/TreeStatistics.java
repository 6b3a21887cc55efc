package com.pagecraft.service.tree;

import io.micronaut.serde.annotation.Serdeable;

import java.util.Map;

@Serdeable
public record TreeStatistics(int totalComponents, int maxDepth, Map<String, Integer> componentTypes) {}
