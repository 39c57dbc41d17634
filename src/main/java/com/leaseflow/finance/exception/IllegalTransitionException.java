package com.leaseflow.finance.exception;

/**
 * A status change or edit that the document's current status does not allow.
 */
public class IllegalTransitionException extends FinanceEngineException {

    private final String fromStatus;
    private final String toStatus;

    public IllegalTransitionException(String message, Enum<?> fromStatus, Enum<?> toStatus) {
        super(message, "ILLEGAL_TRANSITION");
        this.fromStatus = fromStatus != null ? fromStatus.name() : null;
        this.toStatus = toStatus != null ? toStatus.name() : null;
    }

    public String getFromStatus() {
        return fromStatus;
    }

    public String getToStatus() {
        return toStatus;
    }
}
