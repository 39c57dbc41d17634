package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.Invoice;
import com.leaseflow.finance.domain.InvoiceField;
import com.leaseflow.finance.domain.Money;
import com.leaseflow.finance.domain.PaymentSummary;
import com.leaseflow.finance.domain.Receipt;
import com.leaseflow.finance.domain.ReceiptStatus;
import com.leaseflow.finance.domain.ReconciliationResult;
import com.leaseflow.finance.exception.IllegalTransitionException;
import com.leaseflow.finance.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Service for reconciling receipts against an invoice.
 *
 * The invoice's paid amount is always rebuilt from the full set of receipts passed in, never
 * incremented, so applying the same receipts twice gives the same result.
 *
 * Clearing policy:
 * - CLEARED receipts are settled and make up the paid amount
 * - RECEIVED and DEPOSITED receipts are pending (money in transit, e.g. an undeposited cheque)
 * - CANCELLED, BOUNCED and REVERSED receipts are ignored
 */
@Service
public class PaymentReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PaymentReconciliationService.class);

    public static final Set<ReceiptStatus> SETTLED_STATUSES = EnumSet.of(ReceiptStatus.CLEARED);

    public static final Set<ReceiptStatus> PENDING_STATUSES =
        EnumSet.of(ReceiptStatus.RECEIVED, ReceiptStatus.DEPOSITED);

    public static final Set<ReceiptStatus> EXCLUDED_STATUSES =
        EnumSet.of(ReceiptStatus.CANCELLED, ReceiptStatus.BOUNCED, ReceiptStatus.REVERSED);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final InvoiceComputationService invoiceComputationService;
    private final InvoiceLifecycleService invoiceLifecycleService;

    public PaymentReconciliationService(InvoiceComputationService invoiceComputationService,
                                        InvoiceLifecycleService invoiceLifecycleService) {
        this.invoiceComputationService = invoiceComputationService;
        this.invoiceLifecycleService = invoiceLifecycleService;
    }

    /**
     * Applies the receipts to the invoice.
     *
     * @param invoice the invoice to reconcile; not modified
     * @param receipts every receipt recorded against the invoice. Duplicates (same receipt ID)
     *                 count once, the last occurrence wins.
     * @return the updated invoice and a payment summary
     * @throws ValidationException if a receipt belongs to another invoice or currency
     * @throws IllegalTransitionException if the invoice is cancelled, or is paid and the receipts
     *         would change its paid amount
     */
    public ReconciliationResult apply(Invoice invoice, Collection<Receipt> receipts) {
        if (invoice.isCancelled()) {
            throw new IllegalTransitionException(
                "Cannot apply payments to cancelled invoice " + invoice.getInvoiceNo(),
                invoice.getStatus(), invoice.getStatus());
        }

        Map<Long, Receipt> unique = deduplicate(invoice, receipts);

        Money settled = invoice.money(BigDecimal.ZERO);
        Money pending = invoice.money(BigDecimal.ZERO);
        int receiptCount = 0;
        int pendingCount = 0;

        for (Receipt receipt : unique.values()) {
            ReceiptStatus status = receipt.getStatus();
            if (EXCLUDED_STATUSES.contains(status)) {
                continue;
            }
            receiptCount++;
            if (SETTLED_STATUSES.contains(status)) {
                settled = settled.plus(receipt.getReceivedAmount());
            } else if (PENDING_STATUSES.contains(status)) {
                pending = pending.plus(receipt.getReceivedAmount());
                pendingCount++;
            }
        }

        if (invoice.isPaid() && settled.compareTo(invoice.getPaidAmount()) != 0) {
            throw new IllegalTransitionException(
                "Invoice " + invoice.getInvoiceNo() + " is paid; settled receipts of " + settled
                    + " do not match its paid amount of " + invoice.getPaidAmount(),
                invoice.getStatus(), invoice.getStatus());
        }

        Invoice updated = invoice.copy();
        updated.setPaidAmount(settled);
        updated = invoiceComputationService.recompute(updated, EnumSet.of(InvoiceField.PAID_AMOUNT));
        updated = invoiceLifecycleService.applyPaymentStatus(updated);

        PaymentSummary summary = new PaymentSummary(settled, pending, receiptCount, pendingCount,
            progressPercent(settled, updated.getTotalAmount()));

        log.debug("Reconciled invoice {}: paid {}, pending {}, balance {}, status {}",
            invoice.getInvoiceNo(), settled, pending, updated.getBalanceAmount(), updated.getStatus());

        return new ReconciliationResult(updated, summary);
    }

    /**
     * Paid amount as a percentage of the total, 2 decimal places. 0 for a zero total.
     */
    public BigDecimal progressPercent(Money paid, Money total) {
        if (total.isZero()) {
            return BigDecimal.ZERO.setScale(2);
        }
        return paid.toDecimal()
            .multiply(HUNDRED)
            .divide(total.toDecimal(), 2, RoundingMode.HALF_UP);
    }

    private Map<Long, Receipt> deduplicate(Invoice invoice, Collection<Receipt> receipts) {
        Map<Long, Receipt> unique = new LinkedHashMap<>();
        if (receipts == null) {
            return unique;
        }

        for (Receipt receipt : receipts) {
            if (receipt.getReceiptId() == null) {
                throw new ValidationException("Receipt ID is required", "receiptId");
            }
            if (receipt.getStatus() == null) {
                throw new ValidationException("Receipt " + receipt.getReceiptId() + " has no status",
                    "paymentStatus");
            }
            if (receipt.getInvoiceId() != null && invoice.getInvoiceId() != null
                    && !Objects.equals(receipt.getInvoiceId(), invoice.getInvoiceId())) {
                throw new ValidationException(
                    "Receipt " + receipt.getReceiptId() + " belongs to invoice " + receipt.getInvoiceId(),
                    "invoiceId");
            }

            Money amount = receipt.getReceivedAmount();
            if (amount == null) {
                throw new ValidationException("Receipt " + receipt.getReceiptId() + " has no amount",
                    "receivedAmount");
            }
            if (!invoice.getCurrency().equals(amount.getCurrency())) {
                throw new ValidationException(
                    "Receipt " + receipt.getReceiptId() + " is in " + amount.getCurrency()
                        + ", invoice is in " + invoice.getCurrency(), "currency");
            }
            if (amount.isNegative()) {
                throw new ValidationException("negative amount", "receivedAmount");
            }

            unique.put(receipt.getReceiptId(), receipt);
        }
        return unique;
    }
}
