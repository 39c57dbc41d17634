package com.leaseflow.finance.exception;

/**
 * Base exception for every failure raised by the finance engine.
 *
 * Unchecked, so the document services keep clean signatures while still carrying a
 * machine-readable error code that calling layers can map to field errors or toasts.
 */
public class FinanceEngineException extends RuntimeException {

    private final String code;

    public FinanceEngineException(String message, String code) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
