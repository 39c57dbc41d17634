package com.leaseflow.finance.domain;

import java.math.BigDecimal;

/**
 * Payment position of an invoice after reconciliation.
 *
 * @param totalPaid settled amount, i.e. the invoice's paid amount
 * @param pendingAmount received or deposited amounts that have not cleared yet
 * @param receiptCount receipts that were not cancelled, bounced or reversed
 * @param pendingCount receipts still waiting to clear
 * @param paymentProgressPercent totalPaid as a percentage of the invoice total, 0 for a zero total
 */
public record PaymentSummary(Money totalPaid, Money pendingAmount, int receiptCount,
                             int pendingCount, BigDecimal paymentProgressPercent) {}
