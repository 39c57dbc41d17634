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
 * Approval state of an invoice, tracked alongside its lifecycle status.
 * PENDING → APPROVED or REJECTED; both go back to PENDING on a reset.
 */
public enum ApprovalStatus {
    PENDING("Pending"),
    APPROVED("Approved"),
    REJECTED("Rejected");

    private static final Map<ApprovalStatus, Set<ApprovalStatus>> TRANSITIONS = new EnumMap<>(ApprovalStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(APPROVED, REJECTED));
        TRANSITIONS.put(APPROVED, EnumSet.of(PENDING));
        TRANSITIONS.put(REJECTED, EnumSet.of(PENDING));
        TRANSITIONS.replaceAll((status, targets) -> Collections.unmodifiableSet(targets));
    }

    private final String label;

    ApprovalStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean canTransitionTo(ApprovalStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    @JsonCreator
    public static ApprovalStatus fromLabel(String label) {
        for (ApprovalStatus status : values()) {
            if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new ValidationException("Unknown approval status: " + label, "approvalStatus");
    }
}
