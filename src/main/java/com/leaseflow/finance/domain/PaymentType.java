package com.leaseflow.finance.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.leaseflow.finance.exception.ValidationException;

public enum PaymentType {
    CASH("Cash"),
    CHEQUE("Cheque"),
    BANK_TRANSFER("Bank Transfer"),
    ONLINE("Online Payment"),
    WIRE_TRANSFER("Wire Transfer"),
    CREDIT_CARD("Credit Card"),
    DEBIT_CARD("Debit Card");

    private final String label;

    PaymentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static PaymentType fromLabel(String label) {
        for (PaymentType type : values()) {
            if (type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label)) {
                return type;
            }
        }
        if ("Online".equalsIgnoreCase(label)) {
            return ONLINE;
        }
        throw new ValidationException("Unknown payment type: " + label, "paymentType");
    }
}
