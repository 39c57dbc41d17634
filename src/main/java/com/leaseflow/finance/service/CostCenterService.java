package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.CostCenterOption;
import com.leaseflow.finance.domain.CostCenterSelection;
import com.leaseflow.finance.domain.CostCenterSelectionState;
import com.leaseflow.finance.domain.VoucherLine;
import com.leaseflow.finance.exception.InvalidParentException;
import com.leaseflow.finance.exception.ValidationException;
import com.leaseflow.finance.repository.CostCenterRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Service for the four-level cost-center hierarchy.
 *
 * A level's valid values depend on everything selected above it, so the options are always
 * fetched for a complete parent chain.
 */
@Service
public class CostCenterService {

    private final CostCenterRepository costCenterRepository;

    public CostCenterService(CostCenterRepository costCenterRepository) {
        this.costCenterRepository = costCenterRepository;
    }

    /**
     * Returns the cost centers selectable at a level under the given parents.
     * Only levels 1..level-1 of {@code parentChain} are used.
     *
     * @throws ValidationException if the level is outside 1..4
     * @throws InvalidParentException if a parent level is missing
     */
    public List<CostCenterOption> resolveOptions(int level, CostCenterSelection parentChain) {
        if (level < 1 || level > CostCenterSelection.MAX_LEVEL) {
            throw new ValidationException(
                "Cost center level must be between 1 and " + CostCenterSelection.MAX_LEVEL, "level");
        }
        CostCenterSelection chain = parentChain != null ? parentChain : CostCenterSelection.EMPTY;
        if (chain.depth() < level - 1) {
            throw new InvalidParentException(
                "Select cost center levels 1 to " + (level - 1) + " before level " + level, level);
        }
        return List.copyOf(costCenterRepository.findByLevelAndParents(level, chain.truncate(level - 1)));
    }

    /**
     * Selects (or with a null value, clears) a level of the current selection.
     *
     * The returned options are those of the level the user picks next: the level below the
     * selected one, or the cleared level itself. When the parents of a cleared level are not all
     * set, the options are those of the first unset level. Selecting level 4 leaves nothing to pick.
     *
     * @throws InvalidParentException if the value is not a child of the current parent chain
     */
    public CostCenterSelectionState select(int level, Long value, CostCenterSelection context) {
        CostCenterSelection current = context != null ? context : CostCenterSelection.EMPTY;

        if (value == null) {
            CostCenterSelection cleared = current.select(level, null);
            // Clearing under an incomplete chain offers the first level still to pick
            int nextLevel = Math.min(level, cleared.depth() + 1);
            return new CostCenterSelectionState(cleared, resolveOptions(nextLevel, cleared));
        }

        List<CostCenterOption> options = resolveOptions(level, current);
        boolean valid = options.stream().anyMatch(option -> Objects.equals(option.id(), value));
        if (!valid) {
            throw new InvalidParentException(
                "Cost center " + value + " is not valid at level " + level + " for the selected parents", level);
        }

        CostCenterSelection selected = current.select(level, value);
        List<CostCenterOption> next = level < CostCenterSelection.MAX_LEVEL
            ? resolveOptions(level + 1, selected)
            : List.of();
        return new CostCenterSelectionState(selected, next);
    }

    /**
     * Copies the header's cost centers onto the lines that have none of their own.
     * Lines with any cost center set keep theirs unchanged.
     *
     * @return copies of the lines; the argument list is not modified
     */
    public List<VoucherLine> copyToLines(CostCenterSelection header, List<VoucherLine> lines,
                                         boolean copyCostCenters) {
        List<VoucherLine> result = new ArrayList<>(lines.size());
        for (VoucherLine line : lines) {
            VoucherLine copy = line.copy();
            if (copyCostCenters && header != null && !copy.hasCostCenterOverride()) {
                copy.setCostCenters(header);
            }
            result.add(copy);
        }
        return result;
    }
}
