package com.leaseflow.finance.repository;

import com.leaseflow.finance.domain.CostCenterOption;
import com.leaseflow.finance.domain.CostCenterSelection;

import java.util.List;

/**
 * Source of the cost-center hierarchy. Implemented by the application's persistence layer.
 */
public interface CostCenterRepository {

    /**
     * Finds the cost centers at a level that sit under the given parent chain.
     * For level 1 the chain is empty; for level n it holds levels 1..n-1.
     */
    List<CostCenterOption> findByLevelAndParents(int level, CostCenterSelection parentChain);
}
