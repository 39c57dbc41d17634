package com.leaseflow.finance.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceTest {

    private static final BigDecimal USD_RATE = new BigDecimal("3.6725");

    @Test
    void setExchangeRate_reratesHeldAmounts() {
        Invoice invoice = new Invoice("INV-2001", "USD", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
        invoice.setSubTotal(Money.of("100.00", "USD"));

        invoice.setExchangeRate(USD_RATE);

        assertEquals(Money.of(new BigDecimal("100.00"), "USD", USD_RATE), invoice.getSubTotal());
        assertEquals(0, USD_RATE.compareTo(invoice.getPaidAmount().getExchangeRate()));
        assertEquals(Money.of("367.25", "AED"), invoice.getSubTotal().toBaseCurrency("AED"));
    }

    @Test
    void money_usesInvoiceCurrencyAndRate() {
        Invoice invoice = new Invoice("INV-2001", "USD", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
        invoice.setExchangeRate(USD_RATE);

        assertEquals(Money.of(new BigDecimal("50.00"), "USD", USD_RATE), invoice.money("50.00"));
    }

    @Test
    void copy_carriesApprovalDecision() {
        Invoice invoice = new Invoice("INV-2001", "AED", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
        invoice.setRequiresApproval(true);
        invoice.setApprovalStatus(ApprovalStatus.REJECTED);
        invoice.setRejectionReason("Wrong period");

        Invoice copy = invoice.copy();

        assertTrue(copy.isRequiresApproval());
        assertEquals(ApprovalStatus.REJECTED, copy.getApprovalStatus());
        assertEquals("Wrong period", copy.getRejectionReason());
    }
}
