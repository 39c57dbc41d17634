package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.ApprovalStatus;
import com.leaseflow.finance.domain.BulkApprovalResult;
import com.leaseflow.finance.domain.Invoice;
import com.leaseflow.finance.domain.InvoiceStatus;
import com.leaseflow.finance.exception.FinanceEngineException;
import com.leaseflow.finance.exception.IllegalTransitionException;
import com.leaseflow.finance.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Service governing invoice status.
 *
 * Key rules:
 * 1. Operators move invoices between statuses explicitly, following {@link InvoiceStatus#manualTargets()}
 * 2. PARTIAL and PAID follow the paid amount after reconciliation
 * 3. Overdue is derived from due date and balance; storing OVERDUE is optional
 * 4. Paid or part-paid invoices cannot be deleted; PAID and CANCELLED invoices cannot be re-priced
 * 5. An invoice that requires approval is only sent once approved
 */
@Service
public class InvoiceLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceLifecycleService.class);

    /**
     * Applies an operator-requested status change.
     *
     * @return a copy of the invoice with the new status; the same status is a no-op
     * @throws IllegalTransitionException if the current status does not allow the move
     */
    public Invoice transition(Invoice invoice, InvoiceStatus target) {
        InvoiceStatus current = invoice.getStatus();
        if (current == target) {
            return invoice.copy();
        }

        if (current.isTerminal()) {
            throw new IllegalTransitionException(
                "Invoice " + invoice.getInvoiceNo() + " is " + current.getLabel() + " and cannot change status",
                current, target);
        }
        if (target == InvoiceStatus.PARTIAL) {
            throw new IllegalTransitionException(
                "Partial status is set from received payments, not by hand", current, target);
        }
        if (!current.canTransitionTo(target)) {
            throw new IllegalTransitionException(
                "Cannot move invoice from " + current.getLabel() + " to " + target.getLabel(), current, target);
        }
        if (target == InvoiceStatus.SENT && invoice.isRequiresApproval() && !invoice.isApproved()) {
            throw new IllegalTransitionException(
                "Invoice " + invoice.getInvoiceNo() + " must be approved before it is sent", current, target);
        }

        Invoice result = invoice.copy();
        result.setStatus(target);

        log.info("Invoice {} moved from {} to {}", invoice.getInvoiceNo(), current, target);
        return result;
    }

    /**
     * Moves the invoice to PARTIAL or PAID to match its paid amount. An invoice that was PARTIAL
     * and has nothing settled any more (e.g. its cheque bounced) goes back to PENDING.
     */
    public Invoice applyPaymentStatus(Invoice invoice) {
        Invoice result = invoice.copy();
        if (invoice.isCancelled()) {
            return result;
        }

        boolean anythingPaid = invoice.getPaidAmount().isPositive();
        boolean fullyPaid = anythingPaid && invoice.getPaidAmount().compareTo(invoice.getTotalAmount()) >= 0;

        if (fullyPaid) {
            result.setStatus(InvoiceStatus.PAID);
        } else if (anythingPaid) {
            result.setStatus(InvoiceStatus.PARTIAL);
        } else if (invoice.getStatus() == InvoiceStatus.PARTIAL) {
            result.setStatus(InvoiceStatus.PENDING);
        }

        if (result.getStatus() != invoice.getStatus()) {
            log.debug("Invoice {} payment status {} -> {}", invoice.getInvoiceNo(),
                invoice.getStatus(), result.getStatus());
        }
        return result;
    }

    /**
     * Returns true if the invoice has an outstanding balance past its due date, whatever status is
     * stored on it.
     */
    public boolean isOverdue(Invoice invoice, LocalDate today) {
        return invoice.getBalanceAmount().isPositive()
            && invoice.getDueDate() != null
            && invoice.getDueDate().isBefore(today)
            && !invoice.isPaid()
            && !invoice.isCancelled();
    }

    /**
     * Days past the due date, or 0 when the invoice is not overdue.
     */
    public long overdueDays(Invoice invoice, LocalDate today) {
        if (!isOverdue(invoice, today)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(invoice.getDueDate(), today);
    }

    /**
     * Stores OVERDUE on an overdue invoice. Part-paid invoices keep PARTIAL, since that status
     * tracks payments.
     */
    public Invoice markOverdue(Invoice invoice, LocalDate today) {
        if (!isOverdue(invoice, today)
                || invoice.getStatus() == InvoiceStatus.OVERDUE
                || invoice.getStatus() == InvoiceStatus.PARTIAL) {
            return invoice.copy();
        }
        return transition(invoice, InvoiceStatus.OVERDUE);
    }

    /**
     * @throws IllegalTransitionException if the invoice is paid or has any payment against it
     */
    public void assertDeletable(Invoice invoice) {
        if (invoice.isPaid() || invoice.getPaidAmount().isPositive()) {
            throw new IllegalTransitionException(
                "Invoice " + invoice.getInvoiceNo() + " has payments and cannot be deleted",
                invoice.getStatus(), null);
        }
    }

    /**
     * @throws IllegalTransitionException if the invoice is PAID or CANCELLED
     */
    public void assertMonetaryEditable(Invoice invoice) {
        if (invoice.getStatus().isTerminal()) {
            throw new IllegalTransitionException(
                "Amounts of a " + invoice.getStatus().getLabel() + " invoice cannot be changed",
                invoice.getStatus(), invoice.getStatus());
        }
    }

    // Approval

    /**
     * Approves an invoice awaiting approval.
     *
     * @throws ValidationException if no approver is given
     * @throws IllegalTransitionException if the invoice is not awaiting approval, or is paid or cancelled
     */
    public Invoice approve(Invoice invoice, String approvedBy, String comments, LocalDateTime approvedOn) {
        if (approvedBy == null || approvedBy.isBlank()) {
            throw new ValidationException("Approver is required", "approvedBy");
        }
        requireApprovalChange(invoice, ApprovalStatus.APPROVED);

        Invoice result = invoice.copy();
        result.setApprovalStatus(ApprovalStatus.APPROVED);
        result.setApprovedBy(approvedBy);
        result.setApprovedOn(approvedOn);
        result.setApprovalComments(comments);
        result.setRejectionReason(null);

        log.info("Invoice {} approved by {}", invoice.getInvoiceNo(), approvedBy);
        return result;
    }

    /**
     * Rejects an invoice awaiting approval.
     *
     * @throws ValidationException if the reason is blank
     * @throws IllegalTransitionException if the invoice is not awaiting approval, or is paid or cancelled
     */
    public Invoice reject(Invoice invoice, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Rejection reason is required", "rejectionReason");
        }
        requireApprovalChange(invoice, ApprovalStatus.REJECTED);

        Invoice result = invoice.copy();
        result.setApprovalStatus(ApprovalStatus.REJECTED);
        result.setRejectionReason(reason.trim());
        result.setApprovedBy(null);
        result.setApprovedOn(null);
        result.setApprovalComments(null);

        log.info("Invoice {} rejected: {}", invoice.getInvoiceNo(), reason);
        return result;
    }

    /**
     * Puts the invoice back to awaiting approval and clears the previous decision.
     * An invoice already awaiting approval is returned unchanged.
     */
    public Invoice resetApproval(Invoice invoice) {
        if (invoice.getApprovalStatus() == ApprovalStatus.PENDING) {
            return invoice.copy();
        }
        requireApprovalChange(invoice, ApprovalStatus.PENDING);

        Invoice result = invoice.copy();
        result.setApprovalStatus(ApprovalStatus.PENDING);
        result.setApprovedBy(null);
        result.setApprovedOn(null);
        result.setApprovalComments(null);
        result.setRejectionReason(null);

        log.info("Approval of invoice {} reset from {}", invoice.getInvoiceNo(), invoice.getApprovalStatus());
        return result;
    }

    public BulkApprovalResult approveAll(Collection<Invoice> invoices, String approvedBy, String comments,
                                         LocalDateTime approvedOn) {
        return forEachInvoice(invoices, invoice -> approve(invoice, approvedBy, comments, approvedOn));
    }

    public BulkApprovalResult rejectAll(Collection<Invoice> invoices, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Rejection reason is required", "rejectionReason");
        }
        return forEachInvoice(invoices, invoice -> reject(invoice, reason));
    }

    /**
     * Invoices that require approval and are still waiting for a decision.
     */
    public List<Invoice> pendingApproval(Collection<Invoice> invoices) {
        return invoices.stream()
            .filter(Invoice::isRequiresApproval)
            .filter(invoice -> invoice.getApprovalStatus() == ApprovalStatus.PENDING)
            .filter(invoice -> !invoice.getStatus().isTerminal())
            .toList();
    }

    private void requireApprovalChange(Invoice invoice, ApprovalStatus target) {
        ApprovalStatus current = invoice.getApprovalStatus();
        if (invoice.getStatus().isTerminal()) {
            throw new IllegalTransitionException(
                "Approval of a " + invoice.getStatus().getLabel() + " invoice cannot change", current, target);
        }
        if (!current.canTransitionTo(target)) {
            throw new IllegalTransitionException(
                "Invoice " + invoice.getInvoiceNo() + " is " + current.getLabel() + ", cannot move to "
                    + target.getLabel(), current, target);
        }
    }

    private BulkApprovalResult forEachInvoice(Collection<Invoice> invoices, UnaryOperator<Invoice> action) {
        if (invoices == null || invoices.isEmpty()) {
            throw new ValidationException("No invoices selected", "invoiceIds");
        }
        List<Invoice> processed = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (Invoice invoice : invoices) {
            try {
                processed.add(action.apply(invoice));
            } catch (FinanceEngineException e) {
                failures.put(invoice.getInvoiceNo(), e.getMessage());
            }
        }
        log.info("Bulk approval action: {} processed, {} failed", processed.size(), failures.size());
        return new BulkApprovalResult(processed, failures);
    }
}
