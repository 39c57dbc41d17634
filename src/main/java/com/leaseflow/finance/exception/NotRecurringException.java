package com.leaseflow.finance.exception;

public class NotRecurringException extends FinanceEngineException {

    public NotRecurringException(String invoiceNo) {
        super("Invoice " + invoiceNo + " is not a recurring invoice", "NOT_RECURRING");
    }
}
