package com.leaseflow.finance.service;

import com.leaseflow.finance.config.FinanceEngineProperties;
import com.leaseflow.finance.exception.ValidationException;
import com.leaseflow.finance.repository.VoucherNumberSequence;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Generates document numbers for documents the engine creates itself: recurring invoices,
 * payment vouchers without a number and reversal vouchers.
 */
@Component
public class DocumentNumberGenerator {

    private static final DateTimeFormatter DATE_PART = DateTimeFormatter.BASIC_ISO_DATE;

    private final FinanceEngineProperties properties;
    private final VoucherNumberSequence voucherNumberSequence;

    public DocumentNumberGenerator(FinanceEngineProperties properties, VoucherNumberSequence voucherNumberSequence) {
        this.properties = properties;
        this.voucherNumberSequence = voucherNumberSequence;
    }

    /**
     * Number of the invoice generated from a recurring series for the given date,
     * e.g. INV-1001-20240201. The same root and date always give the same number.
     */
    public String recurringInvoiceNumber(String rootInvoiceNo, LocalDate invoiceDate) {
        if (rootInvoiceNo == null || rootInvoiceNo.isBlank()) {
            throw new ValidationException("Recurring invoice has no invoice number", "invoiceNo");
        }
        return rootInvoiceNo + "-" + invoiceDate.format(DATE_PART);
    }

    /**
     * Voucher number in the form PV-20240115-0007, taking the sequence from
     * {@link VoucherNumberSequence}.
     */
    public String voucherNumber(LocalDate transactionDate) {
        String prefix = properties.getVoucherNumberPrefix();
        long sequence = voucherNumberSequence.next(prefix, transactionDate);
        if (sequence < 1) {
            throw new ValidationException("Voucher sequence must start at 1, got " + sequence, "voucherNo");
        }
        return String.format("%s-%s-%04d", prefix, transactionDate.format(DATE_PART), sequence);
    }

    public String reversalNumber(String voucherNo) {
        return voucherNo + "-" + properties.getReversalSuffix();
    }
}
