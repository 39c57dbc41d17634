package com.leaseflow.finance.domain;

/**
 * Outcome of balancing a payment voucher's lines against its header total.
 *
 * @param difference header total minus line total; positive when the lines are short
 */
public record BalanceCheck(boolean balanced, Money totalAmount, Money lineTotal, Money difference) {}
