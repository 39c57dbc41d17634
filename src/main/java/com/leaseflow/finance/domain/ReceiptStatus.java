package com.leaseflow.finance.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.leaseflow.finance.exception.ValidationException;

public enum ReceiptStatus {
    RECEIVED("Received"),
    DEPOSITED("Deposited"),
    CLEARED("Cleared"),
    BOUNCED("Bounced"),
    CANCELLED("Cancelled"),
    REVERSED("Reversed");

    private final String label;

    ReceiptStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static ReceiptStatus fromLabel(String label) {
        for (ReceiptStatus status : values()) {
            if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new ValidationException("Unknown receipt status: " + label, "paymentStatus");
    }
}
