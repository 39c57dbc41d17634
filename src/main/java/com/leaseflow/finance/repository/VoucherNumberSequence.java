package com.leaseflow.finance.repository;

import java.time.LocalDate;

/**
 * Hands out voucher sequence numbers. Implemented by the application's persistence layer, which
 * knows the numbers already issued.
 */
public interface VoucherNumberSequence {

    /**
     * Returns the next unused sequence number for vouchers with the given prefix and transaction
     * date, starting at 1.
     */
    long next(String prefix, LocalDate transactionDate);
}
