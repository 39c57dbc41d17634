package com.leaseflow.finance.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.leaseflow.finance.exception.ValidationException;

import java.time.LocalDate;

/**
 * Frequency at which a recurring invoice is issued.
 */
public enum RecurrencePattern {
    DAILY("Daily"),
    WEEKLY("Weekly"),
    MONTHLY("Monthly"),
    QUARTERLY("Quarterly"),
    SEMI_ANNUALLY("Semi-Annually"),
    YEARLY("Yearly");

    private final String label;

    RecurrencePattern(String label) {
        this.label = label;
    }

    /**
     * Adds one unit of this pattern. Month-based steps clamp to the last day of a shorter month.
     */
    public LocalDate advance(LocalDate date) {
        return switch (this) {
            case DAILY -> date.plusDays(1);
            case WEEKLY -> date.plusWeeks(1);
            case MONTHLY -> date.plusMonths(1);
            case QUARTERLY -> date.plusMonths(3);
            case SEMI_ANNUALLY -> date.plusMonths(6);
            case YEARLY -> date.plusYears(1);
        };
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static RecurrencePattern fromLabel(String label) {
        for (RecurrencePattern pattern : values()) {
            if (pattern.label.equalsIgnoreCase(label) || pattern.name().equalsIgnoreCase(label)) {
                return pattern;
            }
        }
        // "Annually" is what older lease contracts carry
        if ("Annually".equalsIgnoreCase(label)) {
            return YEARLY;
        }
        throw new ValidationException("Unknown recurrence pattern: " + label, "recurrencePattern");
    }
}
