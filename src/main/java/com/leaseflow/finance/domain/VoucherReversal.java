package com.leaseflow.finance.domain;

/**
 * Pair produced by reversing a paid voucher: the original, now REVERSED, and the new voucher
 * carrying the negated amounts.
 */
public record VoucherReversal(PaymentVoucher original, PaymentVoucher reversal, String reason) {}
