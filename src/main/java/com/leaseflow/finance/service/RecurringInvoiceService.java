package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.Invoice;
import com.leaseflow.finance.domain.InvoiceStatus;
import com.leaseflow.finance.domain.RecurrencePattern;
import com.leaseflow.finance.exception.NotRecurringException;
import com.leaseflow.finance.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Generates the next invoice of a recurring series.
 *
 * Advancement only happens when a caller asks for it; nothing here runs on a schedule.
 * The source invoice is never modified. The generated invoice carries the series forward:
 * it is itself recurring with NextInvoiceDate one pattern unit later.
 */
@Service
public class RecurringInvoiceService {

    private static final Logger log = LoggerFactory.getLogger(RecurringInvoiceService.class);

    private final InvoiceComputationService invoiceComputationService;
    private final DocumentNumberGenerator documentNumberGenerator;

    public RecurringInvoiceService(InvoiceComputationService invoiceComputationService,
                                   DocumentNumberGenerator documentNumberGenerator) {
        this.invoiceComputationService = invoiceComputationService;
        this.documentNumberGenerator = documentNumberGenerator;
    }

    /**
     * Returns true if the series has an invoice due on or before the given date.
     */
    public boolean isDue(Invoice invoice, LocalDate asOf) {
        return invoice.isRecurring()
            && invoice.getNextInvoiceDate() != null
            && !asOf.isBefore(invoice.getNextInvoiceDate());
    }

    /**
     * Creates the next Draft invoice of the series.
     *
     * @throws NotRecurringException if the invoice is not recurring
     * @throws ValidationException if the next invoice date is after {@code asOf}
     */
    public Invoice advance(Invoice source, LocalDate asOf) {
        if (!source.isRecurring()) {
            throw new NotRecurringException(source.getInvoiceNo());
        }
        invoiceComputationService.validate(source);

        LocalDate nextDate = source.getNextInvoiceDate();
        if (asOf.isBefore(nextDate)) {
            throw new ValidationException(
                "Next invoice of " + source.getInvoiceNo() + " is not due until " + nextDate, "nextInvoiceDate");
        }

        RecurrencePattern pattern = source.getRecurrencePattern();
        long dueOffsetDays = ChronoUnit.DAYS.between(source.getInvoiceDate(), source.getDueDate());

        Invoice next = new Invoice(
            documentNumberGenerator.recurringInvoiceNumber(source.getRecurrenceRootNo(), nextDate),
            source.getCurrency(), nextDate, nextDate.plusDays(dueOffsetDays));
        next.setInvoiceType(source.getInvoiceType());
        next.setStatus(InvoiceStatus.DRAFT);
        next.setCustomerId(source.getCustomerId());
        next.setContractId(source.getContractId());
        next.setExchangeRate(source.getExchangeRate());
        next.setNotes(source.getNotes());
        next.setRequiresApproval(source.isRequiresApproval());
        next.setSourceInvoiceNo(source.getRecurrenceRootNo());

        if (source.getPeriodFromDate() != null) {
            next.setPeriodFromDate(pattern.advance(source.getPeriodFromDate()));
        }
        if (source.getPeriodToDate() != null) {
            next.setPeriodToDate(pattern.advance(source.getPeriodToDate()));
        }

        next.setSubTotal(source.getSubTotal());
        next.setTaxId(source.getTaxId());
        next.setDiscountAmount(source.getDiscountAmount());
        if (source.getTaxId() == null) {
            // Manually entered tax has nothing to be re-derived from
            next.setTaxAmount(source.getTaxAmount());
        }
        next.setPaidAmount(next.money("0"));

        next.setRecurring(true);
        next.setRecurrencePattern(pattern);
        next.setNextInvoiceDate(pattern.advance(nextDate));

        Invoice computed = invoiceComputationService.recompute(next);

        log.info("Generated recurring invoice {} from {} ({}), next due {}",
            computed.getInvoiceNo(), source.getInvoiceNo(), pattern, computed.getNextInvoiceDate());
        return computed;
    }
}
