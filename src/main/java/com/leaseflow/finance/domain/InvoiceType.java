package com.leaseflow.finance.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.leaseflow.finance.exception.ValidationException;

public enum InvoiceType {
    REGULAR("Regular"),
    ADVANCE("Advance"),
    SECURITY_DEPOSIT("Security Deposit"),
    PENALTY("Penalty"),
    ADJUSTMENT("Adjustment");

    private final String label;

    InvoiceType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static InvoiceType fromLabel(String label) {
        for (InvoiceType type : values()) {
            if (type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new ValidationException("Unknown invoice type: " + label, "invoiceType");
    }
}
