package com.leaseflow.finance.exception;

/**
 * A cost-center level was selected without a valid parent chain.
 */
public class InvalidParentException extends FinanceEngineException {

    private final int level;

    public InvalidParentException(String message, int level) {
        super(message, "INVALID_PARENT");
        this.level = level;
    }

    public int getLevel() {
        return level;
    }
}
