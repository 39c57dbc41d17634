package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.*;
import com.leaseflow.finance.exception.ValidationException;
import com.leaseflow.finance.repository.TaxCodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static com.leaseflow.finance.service.TestDocuments.AED;
import static com.leaseflow.finance.service.TestDocuments.invoice;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InvoiceComputationServiceTest {

    @Mock
    private TaxCodeRepository taxCodeRepository;

    private InvoiceComputationService computationService;

    @BeforeEach
    void setUp() {
        computationService = new InvoiceComputationService(
            new TaxCalculationService(taxCodeRepository), TestDocuments.documentValidator());
    }

    private void stubTenPercentTax() {
        when(taxCodeRepository.findById(1L))
            .thenReturn(Optional.of(new TaxCode(1L, "VAT 10%", new BigDecimal("10"))));
    }

    @Test
    void recompute_derivesTaxTotalAndBalance() {
        stubTenPercentTax();
        Invoice invoice = invoice("1000.00");
        invoice.setTaxId(1L);
        invoice.setDiscountAmount(Money.of("50.00", AED));

        Invoice result = computationService.recompute(invoice);

        assertEquals(Money.of("100.00", AED), result.getTaxAmount());
        assertEquals(Money.of("1050.00", AED), result.getTotalAmount());
        assertEquals(Money.of("1050.00", AED), result.getBalanceAmount());
        assertEquals(InvoiceStatus.DRAFT, result.getStatus());
    }

    @Test
    void recompute_isIdempotent() {
        stubTenPercentTax();
        Invoice invoice = invoice("1000.00");
        invoice.setTaxId(1L);
        invoice.setDiscountAmount(Money.of("50.00", AED));
        invoice.setPaidAmount(Money.of("200.00", AED));

        Invoice once = computationService.recompute(invoice);
        Invoice twice = computationService.recompute(once);

        assertEquals(once.getTaxAmount(), twice.getTaxAmount());
        assertEquals(once.getTotalAmount(), twice.getTotalAmount());
        assertEquals(once.getBalanceAmount(), twice.getBalanceAmount());
        assertEquals(Money.of("850.00", AED), twice.getBalanceAmount());
    }

    @Test
    void recompute_doesNotModifyInput() {
        Invoice invoice = invoice("500.00");

        Invoice result = computationService.recompute(invoice);

        assertNotSame(invoice, result);
        assertTrue(invoice.getTotalAmount().isZero());
        assertEquals(Money.of("500.00", AED), result.getTotalAmount());
    }

    @Test
    void recompute_discountLargerThanAmount_clampsTotalToZero() {
        Invoice invoice = invoice("100.00");
        invoice.setDiscountAmount(Money.of("150.00", AED));

        Invoice result = computationService.recompute(invoice);

        assertTrue(result.getTotalAmount().isZero());
        assertTrue(result.getBalanceAmount().isZero());
    }

    @Test
    void recompute_overpaid_clampsBalanceToZero() {
        Invoice invoice = invoice("100.00");
        invoice.setPaidAmount(Money.of("120.00", AED));

        Invoice result = computationService.recompute(invoice);

        assertTrue(result.getBalanceAmount().isZero());
    }

    @Test
    void recompute_withoutTaxId_keepsManualTax() {
        Invoice invoice = invoice("100.00");
        invoice.setTaxAmount(Money.of("7.50", AED));

        Invoice result = computationService.recompute(invoice);

        assertEquals(Money.of("7.50", AED), result.getTaxAmount());
        assertEquals(Money.of("107.50", AED), result.getTotalAmount());
    }

    @Test
    void recompute_taxIdCleared_zeroesTax() {
        Invoice invoice = invoice("100.00");
        invoice.setTaxAmount(Money.of("10.00", AED));

        Invoice result = computationService.recompute(invoice, EnumSet.of(InvoiceField.TAX_ID));

        assertTrue(result.getTaxAmount().isZero());
        assertEquals(Money.of("100.00", AED), result.getTotalAmount());
    }

    @Test
    void recompute_onlyDiscountChanged_doesNotRederiveTax() {
        Invoice invoice = invoice("1000.00");
        invoice.setTaxId(1L);
        invoice.setTaxAmount(Money.of("100.00", AED));
        invoice.setDiscountAmount(Money.of("25.00", AED));

        Invoice result = computationService.recompute(invoice, EnumSet.of(InvoiceField.DISCOUNT_AMOUNT));

        assertEquals(Money.of("1075.00", AED), result.getTotalAmount());
        verifyNoInteractions(taxCodeRepository);
    }

    @Test
    void recompute_negativeSubTotal_throws() {
        Invoice invoice = invoice("-1.00");

        ValidationException ex = assertThrows(ValidationException.class,
            () -> computationService.recompute(invoice));

        assertEquals("negative amount", ex.getMessage());
        assertEquals("subTotal", ex.getField());
    }

    @Test
    void recompute_amountInOtherCurrency_throws() {
        Invoice invoice = invoice("100.00");
        invoice.setDiscountAmount(Money.of("5.00", "USD"));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> computationService.recompute(invoice));

        assertEquals("currency", ex.getField());
    }

    @Test
    void recompute_amountWithOtherExchangeRate_throws() {
        Invoice invoice = new Invoice("INV-2001", "USD", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
        invoice.setExchangeRate(new BigDecimal("3.6725"));
        invoice.setSubTotal(Money.of("100.00", "USD"));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> computationService.recompute(invoice));

        assertEquals("exchangeRate", ex.getField());
    }

    @Test
    void recompute_keepsInvoiceExchangeRateOnDerivedAmounts() {
        BigDecimal rate = new BigDecimal("3.6725");
        Invoice invoice = new Invoice("INV-2001", "USD", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
        invoice.setExchangeRate(rate);
        invoice.setSubTotal(invoice.money("100.00"));

        Invoice result = computationService.recompute(invoice);

        assertEquals(0, rate.compareTo(result.getTotalAmount().getExchangeRate()));
        assertEquals(Money.of("367.25", AED), result.getTotalAmount().toBaseCurrency(AED));
    }

    @Test
    void validate_missingInvoiceNo_reportsField() {
        Invoice invoice = invoice("100.00");
        invoice.setInvoiceNo(" ");

        ValidationException ex = assertThrows(ValidationException.class,
            () -> computationService.validate(invoice));

        assertEquals("invoiceNo", ex.getField());
    }

    @Test
    void validate_periodToBeforeFrom_throws() {
        Invoice invoice = invoice("100.00");
        invoice.setPeriodFromDate(LocalDate.of(2024, 1, 31));
        invoice.setPeriodToDate(LocalDate.of(2024, 1, 1));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> computationService.validate(invoice));

        assertEquals("periodToDate", ex.getField());
    }

    @Test
    void validate_dueDateBeforeInvoiceDate_throws() {
        Invoice invoice = invoice("100.00");
        invoice.setDueDate(LocalDate.of(2023, 12, 31));

        assertThrows(ValidationException.class, () -> computationService.validate(invoice));
    }

    @Test
    void validate_recurringWithoutPattern_throws() {
        Invoice invoice = invoice("100.00");
        invoice.setRecurring(true);
        invoice.setNextInvoiceDate(LocalDate.of(2024, 2, 1));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> computationService.validate(invoice));

        assertEquals("recurrencePattern", ex.getField());
    }

    @Test
    void validate_recurringNextDateNotAfterInvoiceDate_throws() {
        Invoice invoice = invoice("100.00");
        invoice.setRecurring(true);
        invoice.setRecurrencePattern(RecurrencePattern.MONTHLY);
        invoice.setNextInvoiceDate(LocalDate.of(2024, 1, 1));

        ValidationException ex = assertThrows(ValidationException.class,
            () -> computationService.validate(invoice));

        assertEquals("nextInvoiceDate", ex.getField());
    }

    @Test
    void changedFields_detectsEditedInputs() {
        Invoice before = invoice("100.00");
        Invoice after = before.copy();
        after.setSubTotal(Money.of("120.00", AED));
        after.setTaxId(1L);

        Set<InvoiceField> changed = computationService.changedFields(before, after);

        assertEquals(EnumSet.of(InvoiceField.SUB_TOTAL, InvoiceField.TAX_ID), changed);
    }

    @Test
    void deriveDueDate_addsPaymentTerm() {
        assertEquals(LocalDate.of(2024, 1, 31), computationService.deriveDueDate(LocalDate.of(2024, 1, 1), 30));
        assertThrows(ValidationException.class,
            () -> computationService.deriveDueDate(LocalDate.of(2024, 1, 1), -1));
    }
}
