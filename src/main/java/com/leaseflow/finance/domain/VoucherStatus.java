package com.leaseflow.finance.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.leaseflow.finance.exception.ValidationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Payment voucher status.
 * Workflow: DRAFT → PENDING → PAID, with REJECTED/CANCELLED exits. A PAID voucher only leaves
 * that status through a reversal, which marks it REVERSED.
 */
public enum VoucherStatus {
    DRAFT("Draft"),
    PENDING("Pending"),
    PAID("Paid"),
    REJECTED("Rejected"),
    CANCELLED("Cancelled"),
    REVERSED("Reversed");

    private static final Map<VoucherStatus, Set<VoucherStatus>> TRANSITIONS = new EnumMap<>(VoucherStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(PENDING, CANCELLED));
        TRANSITIONS.put(PENDING, EnumSet.of(DRAFT, PAID, REJECTED, CANCELLED));
        TRANSITIONS.put(REJECTED, EnumSet.of(DRAFT, CANCELLED));
        TRANSITIONS.put(PAID, EnumSet.noneOf(VoucherStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(VoucherStatus.class));
        TRANSITIONS.put(REVERSED, EnumSet.noneOf(VoucherStatus.class));
        TRANSITIONS.replaceAll((status, targets) -> Collections.unmodifiableSet(targets));
    }

    private final String label;

    VoucherStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isEditable() {
        return this == DRAFT || this == PENDING;
    }

    /**
     * Frozen vouchers can only be corrected by a reversal document.
     */
    public boolean isFrozen() {
        return this == PAID || this == REVERSED;
    }

    public Set<VoucherStatus> allowedTargets() {
        return TRANSITIONS.get(this);
    }

    public boolean canTransitionTo(VoucherStatus target) {
        return allowedTargets().contains(target);
    }

    @JsonCreator
    public static VoucherStatus fromLabel(String label) {
        for (VoucherStatus status : values()) {
            if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new ValidationException("Unknown voucher status: " + label, "paymentStatus");
    }
}
