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
 * Lifecycle status of an invoice.
 *
 * PAID and CANCELLED are terminal: monetary fields are frozen, and CANCELLED additionally
 * allows no transition out. PARTIAL is never set by hand; it follows the paid amount.
 */
public enum InvoiceStatus {
    DRAFT("Draft"),
    PENDING("Pending"),
    SENT("Sent"),
    PARTIAL("Partial"),
    PAID("Paid"),
    OVERDUE("Overdue"),
    CANCELLED("Cancelled");

    private static final Map<InvoiceStatus, Set<InvoiceStatus>> MANUAL_TRANSITIONS =
        new EnumMap<>(InvoiceStatus.class);

    static {
        for (InvoiceStatus from : values()) {
            Set<InvoiceStatus> targets = EnumSet.noneOf(InvoiceStatus.class);
            if (!from.isTerminal()) {
                for (InvoiceStatus to : values()) {
                    if (to != from && to != PARTIAL) {
                        targets.add(to);
                    }
                }
            }
            MANUAL_TRANSITIONS.put(from, Collections.unmodifiableSet(targets));
        }
    }

    private final String label;

    InvoiceStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this == PAID || this == CANCELLED;
    }

    /**
     * Statuses an operator may move to from this one with an explicit command.
     */
    public Set<InvoiceStatus> manualTargets() {
        return MANUAL_TRANSITIONS.get(this);
    }

    public boolean canTransitionTo(InvoiceStatus target) {
        return manualTargets().contains(target);
    }

    @JsonCreator
    public static InvoiceStatus fromLabel(String label) {
        for (InvoiceStatus status : values()) {
            if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new ValidationException("Unknown invoice status: " + label, "status");
    }
}
