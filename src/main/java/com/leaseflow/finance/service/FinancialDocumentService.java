package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.ApprovalStatus;
import com.leaseflow.finance.domain.BalanceCheck;
import com.leaseflow.finance.domain.BulkApprovalResult;
import com.leaseflow.finance.domain.CostCenterOption;
import com.leaseflow.finance.domain.CostCenterSelection;
import com.leaseflow.finance.domain.CostCenterSelectionState;
import com.leaseflow.finance.domain.Invoice;
import com.leaseflow.finance.domain.InvoiceField;
import com.leaseflow.finance.domain.InvoiceStatus;
import com.leaseflow.finance.domain.PaymentVoucher;
import com.leaseflow.finance.domain.Receipt;
import com.leaseflow.finance.domain.ReconciliationResult;
import com.leaseflow.finance.domain.VoucherReversal;
import com.leaseflow.finance.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point used by the application's controllers and jobs.
 *
 * Each method validates, computes and returns new documents; persisting the result is up to the
 * caller. Nothing here is stored between calls.
 */
@Service
public class FinancialDocumentService {

    private static final Logger log = LoggerFactory.getLogger(FinancialDocumentService.class);

    private final InvoiceComputationService invoiceComputationService;
    private final InvoiceLifecycleService invoiceLifecycleService;
    private final RecurringInvoiceService recurringInvoiceService;
    private final PaymentReconciliationService paymentReconciliationService;
    private final VoucherBalancingService voucherBalancingService;
    private final PaymentVoucherService paymentVoucherService;
    private final CostCenterService costCenterService;
    private final Clock clock;

    public FinancialDocumentService(InvoiceComputationService invoiceComputationService,
                                    InvoiceLifecycleService invoiceLifecycleService,
                                    RecurringInvoiceService recurringInvoiceService,
                                    PaymentReconciliationService paymentReconciliationService,
                                    VoucherBalancingService voucherBalancingService,
                                    PaymentVoucherService paymentVoucherService,
                                    CostCenterService costCenterService,
                                    Clock clock) {
        this.invoiceComputationService = invoiceComputationService;
        this.invoiceLifecycleService = invoiceLifecycleService;
        this.recurringInvoiceService = recurringInvoiceService;
        this.paymentReconciliationService = paymentReconciliationService;
        this.voucherBalancingService = voucherBalancingService;
        this.paymentVoucherService = paymentVoucherService;
        this.costCenterService = costCenterService;
        this.clock = clock;
    }

    // Invoices

    public Invoice computeInvoiceTotals(Invoice invoice) {
        Invoice computed = invoiceComputationService.recompute(invoice);
        log.debug("Computed totals for invoice {}: total {}, balance {}",
            computed.getInvoiceNo(), computed.getTotalAmount(), computed.getBalanceAmount());
        return computed;
    }

    /**
     * Applies an edit to an invoice's amounts and recomputes what depends on the changed inputs.
     * Paid and cancelled invoices cannot be re-priced. A pricing change sends an approved or
     * rejected invoice back for approval.
     */
    public Invoice updateInvoiceAmounts(Invoice current, Invoice proposed) {
        if (!Objects.equals(current.getInvoiceNo(), proposed.getInvoiceNo())) {
            throw new ValidationException("Invoice number cannot be changed", "invoiceNo");
        }

        Set<InvoiceField> changed = invoiceComputationService.changedFields(current, proposed);
        if (!changed.isEmpty()) {
            invoiceLifecycleService.assertMonetaryEditable(current);
        }

        Invoice updated = invoiceComputationService.recompute(proposed, changed);
        if (updated.getApprovalStatus() != ApprovalStatus.PENDING
                && changed.stream().anyMatch(InvoiceField::affectsPricing)) {
            updated = invoiceLifecycleService.resetApproval(updated);
        }
        log.info("Updated amounts of invoice {} ({})", updated.getInvoiceNo(), changed);
        return updated;
    }

    public Invoice transitionInvoiceStatus(Invoice invoice, InvoiceStatus newStatus) {
        return invoiceLifecycleService.transition(invoice, newStatus);
    }

    public ReconciliationResult reconcilePayments(Invoice invoice, Collection<Receipt> receipts) {
        ReconciliationResult result = paymentReconciliationService.apply(invoice, receipts);
        log.info("Reconciled invoice {}: paid {}, status {}", invoice.getInvoiceNo(),
            result.summary().totalPaid(), result.invoice().getStatus());
        return result;
    }

    /**
     * Generates the next invoice of a recurring series, if one is due today.
     */
    public Invoice advanceRecurringInvoice(Invoice invoice) {
        return recurringInvoiceService.advance(invoice, today());
    }

    public boolean isOverdue(Invoice invoice) {
        return invoiceLifecycleService.isOverdue(invoice, today());
    }

    public Invoice approveInvoice(Invoice invoice, String approvedBy, String comments) {
        return invoiceLifecycleService.approve(invoice, approvedBy, comments, LocalDateTime.now(clock));
    }

    public Invoice rejectInvoice(Invoice invoice, String reason) {
        return invoiceLifecycleService.reject(invoice, reason);
    }

    public Invoice resetInvoiceApproval(Invoice invoice) {
        return invoiceLifecycleService.resetApproval(invoice);
    }

    public BulkApprovalResult approveInvoices(Collection<Invoice> invoices, String approvedBy, String comments) {
        return invoiceLifecycleService.approveAll(invoices, approvedBy, comments, LocalDateTime.now(clock));
    }

    public BulkApprovalResult rejectInvoices(Collection<Invoice> invoices, String reason) {
        return invoiceLifecycleService.rejectAll(invoices, reason);
    }

    // Payment vouchers

    public BalanceCheck validateVoucherBalance(PaymentVoucher voucher) {
        return voucherBalancingService.validate(voucher);
    }

    public PaymentVoucher createVoucher(PaymentVoucher voucher) {
        return paymentVoucherService.create(voucher);
    }

    public PaymentVoucher updateVoucher(PaymentVoucher current, PaymentVoucher proposed) {
        return paymentVoucherService.update(current, proposed);
    }

    public VoucherReversal reverseVoucher(PaymentVoucher voucher, String reason) {
        return paymentVoucherService.reverse(voucher, reason, today());
    }

    // Cost centers

    public List<CostCenterOption> resolveCostCenterSelection(int level, CostCenterSelection parentChain) {
        return costCenterService.resolveOptions(level, parentChain);
    }

    public CostCenterSelectionState selectCostCenter(int level, Long value, CostCenterSelection context) {
        return costCenterService.select(level, value, context);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
