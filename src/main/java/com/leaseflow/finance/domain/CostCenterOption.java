package com.leaseflow.finance.domain;

/**
 * A selectable cost center at one level of the hierarchy.
 */
public record CostCenterOption(int level, Long id, Long parentId, String description) {}
