package com.leaseflow.finance.domain;

/**
 * Invoice inputs whose change triggers a totals recompute.
 */
public enum InvoiceField {
    SUB_TOTAL,
    TAX_ID,
    TAX_AMOUNT,
    DISCOUNT_AMOUNT,
    PAID_AMOUNT;

    /**
     * True for fields that change what the customer is charged. Editing one of them invalidates
     * an approval; recording payments does not.
     */
    public boolean affectsPricing() {
        return this != PAID_AMOUNT;
    }
}
