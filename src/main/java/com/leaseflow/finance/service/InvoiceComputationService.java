package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.Invoice;
import com.leaseflow.finance.domain.InvoiceField;
import com.leaseflow.finance.domain.Money;
import com.leaseflow.finance.exception.ValidationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Derives an invoice's totals from its inputs.
 *
 * Steps run in a fixed order on a copy of the invoice, so no caller ever sees a half-computed
 * document:
 * 1. TaxAmount from SubTotal and the TaxID rate (only when SubTotal or TaxID changed)
 * 2. TotalAmount = max(0, SubTotal + TaxAmount - DiscountAmount)
 * 3. BalanceAmount = max(0, TotalAmount - PaidAmount)
 *
 * Status is never written here.
 */
@Service
public class InvoiceComputationService {

    /**
     * Change set used when the caller cannot say what changed: tax is re-derived from SubTotal
     * when a TaxID is set, a manually entered tax without TaxID is kept.
     */
    private static final Set<InvoiceField> ALL_AMOUNTS = EnumSet.of(
        InvoiceField.SUB_TOTAL, InvoiceField.TAX_AMOUNT,
        InvoiceField.DISCOUNT_AMOUNT, InvoiceField.PAID_AMOUNT);

    private final TaxCalculationService taxCalculationService;
    private final DocumentValidator documentValidator;

    public InvoiceComputationService(TaxCalculationService taxCalculationService,
                                     DocumentValidator documentValidator) {
        this.taxCalculationService = taxCalculationService;
        this.documentValidator = documentValidator;
    }

    /**
     * Recomputes all derived fields.
     */
    public Invoice recompute(Invoice invoice) {
        return recompute(invoice, ALL_AMOUNTS);
    }

    /**
     * Recomputes derived fields after the given inputs changed.
     *
     * @return a new invoice; the argument is not modified
     * @throws ValidationException for malformed documents or negative inputs
     */
    public Invoice recompute(Invoice invoice, Set<InvoiceField> changed) {
        validate(invoice);

        Invoice result = invoice.copy();

        // 1. Tax
        boolean taxInputsChanged = changed.contains(InvoiceField.SUB_TOTAL)
            || changed.contains(InvoiceField.TAX_ID);
        if (result.getTaxId() != null && taxInputsChanged) {
            result.setTaxAmount(taxCalculationService.computeTax(result.getSubTotal(), result.getTaxId()));
        } else if (result.getTaxId() == null && changed.contains(InvoiceField.TAX_ID)) {
            // Tax removed
            result.setTaxAmount(result.getSubTotal().withAmount(BigDecimal.ZERO));
        }

        // 2. Total
        Money total = result.getSubTotal()
            .plus(result.getTaxAmount())
            .minus(result.getDiscountAmount())
            .atLeastZero();
        result.setTotalAmount(total);

        // 3. Balance
        result.setBalanceAmount(total.minus(result.getPaidAmount()).atLeastZero());

        return result;
    }

    /**
     * Works out which inputs differ between two versions of the same invoice.
     */
    public Set<InvoiceField> changedFields(Invoice before, Invoice after) {
        Set<InvoiceField> changed = EnumSet.noneOf(InvoiceField.class);
        if (!Objects.equals(before.getSubTotal(), after.getSubTotal())) {
            changed.add(InvoiceField.SUB_TOTAL);
        }
        if (!Objects.equals(before.getTaxId(), after.getTaxId())) {
            changed.add(InvoiceField.TAX_ID);
        }
        if (!Objects.equals(before.getTaxAmount(), after.getTaxAmount())) {
            changed.add(InvoiceField.TAX_AMOUNT);
        }
        if (!Objects.equals(before.getDiscountAmount(), after.getDiscountAmount())) {
            changed.add(InvoiceField.DISCOUNT_AMOUNT);
        }
        if (!Objects.equals(before.getPaidAmount(), after.getPaidAmount())) {
            changed.add(InvoiceField.PAID_AMOUNT);
        }
        return changed;
    }

    /**
     * Due date implied by a payment term of the given number of days.
     */
    public LocalDate deriveDueDate(LocalDate invoiceDate, int paymentTermDays) {
        if (paymentTermDays < 0) {
            throw new ValidationException("Payment term days must not be negative", "paymentTermDays");
        }
        return invoiceDate.plusDays(paymentTermDays);
    }

    /**
     * Checks the document-level rules that must hold before totals can be derived.
     */
    public void validate(Invoice invoice) {
        documentValidator.validate(invoice);

        requireNonNegative(invoice.getSubTotal(), "subTotal");
        requireNonNegative(invoice.getTaxAmount(), "taxAmount");
        requireNonNegative(invoice.getDiscountAmount(), "discountAmount");
        requireNonNegative(invoice.getPaidAmount(), "paidAmount");

        for (Money amount : new Money[] {invoice.getSubTotal(), invoice.getTaxAmount(),
                invoice.getDiscountAmount(), invoice.getPaidAmount()}) {
            if (!amount.getCurrency().equals(invoice.getCurrency())) {
                throw new ValidationException(
                    "Amount " + amount + " is not in invoice currency " + invoice.getCurrency(), "currency");
            }
            if (amount.getExchangeRate().compareTo(invoice.getExchangeRate()) != 0) {
                throw new ValidationException(
                    "Amount " + amount + " has exchange rate " + amount.getExchangeRate()
                        + ", invoice rate is " + invoice.getExchangeRate(), "exchangeRate");
            }
        }

        if (invoice.getDueDate().isBefore(invoice.getInvoiceDate())) {
            throw new ValidationException("Due date must not be before invoice date", "dueDate");
        }

        if (invoice.getPeriodFromDate() != null && invoice.getPeriodToDate() != null
                && invoice.getPeriodToDate().isBefore(invoice.getPeriodFromDate())) {
            throw new ValidationException("Period To Date must be after Period From Date", "periodToDate");
        }

        if (invoice.isRecurring()) {
            if (invoice.getRecurrencePattern() == null || invoice.getNextInvoiceDate() == null) {
                throw new ValidationException(
                    "Recurrence pattern and next invoice date are required for recurring invoices",
                    "recurrencePattern");
            }
            if (!invoice.getNextInvoiceDate().isAfter(invoice.getInvoiceDate())) {
                throw new ValidationException("Next invoice date must be after invoice date", "nextInvoiceDate");
            }
        }
    }

    private static void requireNonNegative(Money amount, String field) {
        if (amount.isNegative()) {
            throw new ValidationException("negative amount", field);
        }
    }
}
