package com.leaseflow.finance.domain;

import java.util.List;

/**
 * Result of selecting a cost center: the updated selection and the options that are now valid
 * for the next level down (empty below level 4).
 */
public record CostCenterSelectionState(CostCenterSelection selection, List<CostCenterOption> nextLevelOptions) {}
