package com.leaseflow.finance.domain;

import com.leaseflow.finance.exception.InvalidParentException;
import com.leaseflow.finance.exception.ValidationException;

import java.util.Arrays;

/**
 * An allocation across the four cost-center levels (L1..L4).
 *
 * Each level is only meaningful under its parents: L2 needs L1, L3 needs L1+L2, L4 needs
 * L1+L2+L3. Selecting a level discards every level below it. Instances are immutable.
 */
public final class CostCenterSelection {

    public static final int MAX_LEVEL = 4;

    public static final CostCenterSelection EMPTY = new CostCenterSelection(new Long[MAX_LEVEL]);

    private final Long[] levels;

    private CostCenterSelection(Long[] levels) {
        this.levels = levels;
    }

    /**
     * Builds a selection from raw level ids, as stored on a voucher header or line.
     * Trailing nulls are allowed; a gap (e.g. L3 without L2) is not.
     */
    public static CostCenterSelection of(Long level1, Long level2, Long level3, Long level4) {
        Long[] values = {level1, level2, level3, level4};
        for (int i = 1; i < MAX_LEVEL; i++) {
            if (values[i] != null && values[i - 1] == null) {
                throw new InvalidParentException(
                    "Cost center level " + (i + 1) + " requires level " + i, i + 1);
            }
        }
        return new CostCenterSelection(values);
    }

    /**
     * Returns the id selected at the given level (1-based), or null.
     */
    public Long get(int level) {
        checkLevel(level);
        return levels[level - 1];
    }

    /**
     * Selects a value at a level, clearing all deeper levels. A null value clears the level
     * itself as well.
     */
    public CostCenterSelection select(int level, Long value) {
        checkLevel(level);
        if (value != null && depth() < level - 1) {
            throw new InvalidParentException(
                "Cost center level " + level + " cannot be selected without levels 1 to " + (level - 1),
                level);
        }
        Long[] next = new Long[MAX_LEVEL];
        System.arraycopy(levels, 0, next, 0, level - 1);
        next[level - 1] = value;
        return new CostCenterSelection(next);
    }

    /**
     * Keeps levels 1..level and drops the rest.
     */
    public CostCenterSelection truncate(int level) {
        if (level < 0 || level > MAX_LEVEL) {
            throw new ValidationException("Cost center level must be between 0 and " + MAX_LEVEL, "level");
        }
        Long[] next = new Long[MAX_LEVEL];
        System.arraycopy(levels, 0, next, 0, level);
        return new CostCenterSelection(next);
    }

    /**
     * Number of consecutive levels selected from level 1.
     */
    public int depth() {
        int depth = 0;
        while (depth < MAX_LEVEL && levels[depth] != null) {
            depth++;
        }
        return depth;
    }

    public boolean isEmpty() {
        return levels[0] == null;
    }

    public Long getLevel1() {
        return levels[0];
    }

    public Long getLevel2() {
        return levels[1];
    }

    public Long getLevel3() {
        return levels[2];
    }

    public Long getLevel4() {
        return levels[3];
    }

    private static void checkLevel(int level) {
        if (level < 1 || level > MAX_LEVEL) {
            throw new ValidationException("Cost center level must be between 1 and " + MAX_LEVEL, "level");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CostCenterSelection other && Arrays.equals(levels, other.levels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(levels);
    }

    @Override
    public String toString() {
        return "CostCenterSelection" + Arrays.toString(levels);
    }
}
