package com.leaseflow.finance.exception;

import com.leaseflow.finance.domain.Money;

/**
 * Voucher lines do not sum to the header total.
 * The difference is header total minus line total: positive means the lines are short.
 */
public class OutOfBalanceException extends FinanceEngineException {

    private final Money difference;

    public OutOfBalanceException(Money difference) {
        super("Voucher is out of balance by " + difference, "OUT_OF_BALANCE");
        this.difference = difference;
    }

    public Money getDifference() {
        return difference;
    }
}
