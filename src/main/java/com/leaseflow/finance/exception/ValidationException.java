package com.leaseflow.finance.exception;

/**
 * Malformed or negative input. Always recoverable by correcting the document.
 */
public class ValidationException extends FinanceEngineException {

    private final String field;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String field) {
        this(message, "VALIDATION_ERROR", field);
    }

    public ValidationException(String message, String code, String field) {
        super(message, code);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
