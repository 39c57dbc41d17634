package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.Money;
import com.leaseflow.finance.domain.PaymentVoucher;
import com.leaseflow.finance.domain.VoucherLine;
import com.leaseflow.finance.domain.VoucherReversal;
import com.leaseflow.finance.domain.VoucherStatus;
import com.leaseflow.finance.exception.FrozenDocumentException;
import com.leaseflow.finance.exception.IllegalTransitionException;
import com.leaseflow.finance.exception.OutOfBalanceException;
import com.leaseflow.finance.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for payment voucher commands.
 *
 * Every write goes through the same preparation: bean validation, cost-center copy, line and
 * header tax, then the balance check. A voucher that does not balance is rejected, never adjusted.
 * Paid vouchers are frozen; they are undone with {@link #reverse}.
 */
@Service
public class PaymentVoucherService {

    private static final Logger log = LoggerFactory.getLogger(PaymentVoucherService.class);

    private final DocumentValidator documentValidator;
    private final VoucherBalancingService voucherBalancingService;
    private final CostCenterService costCenterService;
    private final TaxCalculationService taxCalculationService;
    private final DocumentNumberGenerator documentNumberGenerator;

    public PaymentVoucherService(DocumentValidator documentValidator,
                                 VoucherBalancingService voucherBalancingService,
                                 CostCenterService costCenterService,
                                 TaxCalculationService taxCalculationService,
                                 DocumentNumberGenerator documentNumberGenerator) {
        this.documentValidator = documentValidator;
        this.voucherBalancingService = voucherBalancingService;
        this.costCenterService = costCenterService;
        this.taxCalculationService = taxCalculationService;
        this.documentNumberGenerator = documentNumberGenerator;
    }

    /**
     * Prepares a new voucher. A voucher without a number gets a generated one.
     *
     * @throws ValidationException if the voucher is invalid or not Draft/Pending
     * @throws OutOfBalanceException if the lines do not add up to the total
     */
    public PaymentVoucher create(PaymentVoucher voucher) {
        if (voucher.getStatus() != null && !voucher.getStatus().isEditable()) {
            throw new ValidationException("A new voucher must be Draft or Pending", "paymentStatus");
        }

        PaymentVoucher prepared = prepare(voucher);
        if (prepared.getVoucherNo() == null || prepared.getVoucherNo().isBlank()) {
            prepared.setVoucherNo(documentNumberGenerator.voucherNumber(prepared.getTransactionDate()));
        }

        log.info("Created payment voucher {} for {}", prepared.getVoucherNo(), prepared.getTotalAmount());
        return prepared;
    }

    /**
     * Replaces an editable voucher with a new version. The voucher number and status cannot be
     * changed here; status changes go through {@link #transition}.
     *
     * @throws FrozenDocumentException if the current voucher is Paid or Reversed
     * @throws IllegalTransitionException if the current voucher is Cancelled or Rejected
     */
    public PaymentVoucher update(PaymentVoucher current, PaymentVoucher proposed) {
        assertEditable(current);

        if (proposed.getVoucherNo() != null && !proposed.getVoucherNo().equals(current.getVoucherNo())) {
            throw new ValidationException("Voucher number cannot be changed", "voucherNo");
        }
        if (proposed.getStatus() != current.getStatus()) {
            throw new ValidationException("Use a status transition to change the voucher status", "paymentStatus");
        }

        PaymentVoucher candidate = proposed.copy();
        candidate.setVoucherNo(current.getVoucherNo());
        PaymentVoucher prepared = prepare(candidate);

        log.info("Updated payment voucher {}", prepared.getVoucherNo());
        return prepared;
    }

    /**
     * Changes one line's amount and tax percentage and recomputes that line's tax only.
     * The result is not balance-checked; the edit is committed with {@link #update}.
     *
     * @param index zero-based position of the line
     */
    public PaymentVoucher updateLine(PaymentVoucher voucher, int index, Money amount, BigDecimal taxPercentage) {
        assertEditable(voucher);
        if (index < 0 || index >= voucher.getLines().size()) {
            throw new ValidationException("No line at position " + index, "lines");
        }
        if (amount == null || amount.isNegative()) {
            throw new ValidationException("negative amount", "lines.amount");
        }

        PaymentVoucher result = voucher.copy();
        VoucherLine line = result.getLines().get(index);
        line.setAmount(amount);
        line.setTaxPercentage(taxPercentage);
        result.getLines().set(index, voucherBalancingService.recomputeLineTax(line));
        return result;
    }

    /**
     * Moves the voucher to another status. Moving to Paid re-checks the balance.
     *
     * @throws FrozenDocumentException if the voucher is Paid or Reversed; paid vouchers are undone
     *         with {@link #reverse}
     * @throws IllegalTransitionException if the status table does not allow the move
     * @throws OutOfBalanceException when paying a voucher that does not balance
     */
    public PaymentVoucher transition(PaymentVoucher voucher, VoucherStatus target) {
        VoucherStatus current = voucher.getStatus();
        if (current == target) {
            return voucher.copy();
        }
        if (current.isFrozen()) {
            throw new FrozenDocumentException(voucher.getVoucherNo(), current);
        }
        if (!current.canTransitionTo(target)) {
            throw new IllegalTransitionException(
                "Cannot move voucher " + voucher.getVoucherNo() + " from " + current.getLabel()
                    + " to " + target.getLabel(), current, target);
        }
        if (target == VoucherStatus.PAID) {
            voucherBalancingService.requireBalanced(voucher);
        }

        PaymentVoucher result = voucher.copy();
        result.setStatus(target);

        log.info("Payment voucher {} moved from {} to {}", voucher.getVoucherNo(), current, target);
        return result;
    }

    /**
     * Reverses a paid voucher. The original is returned marked Reversed, together with a new Paid
     * voucher carrying the negated amounts and a link back to the original.
     *
     * @throws IllegalTransitionException if the voucher is not Paid
     */
    public VoucherReversal reverse(PaymentVoucher voucher, String reason, LocalDate reversalDate) {
        if (voucher.getStatus() != VoucherStatus.PAID) {
            throw new IllegalTransitionException(
                "Only paid vouchers can be reversed; " + voucher.getVoucherNo() + " is "
                    + voucher.getStatus().getLabel(), voucher.getStatus(), VoucherStatus.REVERSED);
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Reversal reason is required", "narration");
        }

        PaymentVoucher original = voucher.copy();
        original.setStatus(VoucherStatus.REVERSED);

        PaymentVoucher reversal = voucher.copy();
        reversal.setVoucherNo(documentNumberGenerator.reversalNumber(voucher.getVoucherNo()));
        reversal.setReversalOf(voucher.getVoucherNo());
        reversal.setStatus(VoucherStatus.PAID);
        reversal.setTransactionDate(reversalDate);
        reversal.setPostingDate(reversalDate);
        reversal.setNarration(reason);
        reversal.setAttachments(new ArrayList<>());
        reversal.setTotalAmount(voucher.getTotalAmount().negate());
        reversal.setTaxAmount(negate(voucher.getTaxAmount()));
        reversal.setBaseAmount(negate(voucher.getBaseAmount()));
        for (VoucherLine line : reversal.getLines()) {
            line.setAmount(line.getAmount().negate());
            line.setTaxAmount(negate(line.getTaxAmount()));
        }

        log.info("Reversed payment voucher {} with {}: {}", voucher.getVoucherNo(), reversal.getVoucherNo(), reason);
        return new VoucherReversal(original, reversal, reason);
    }

    /**
     * @throws FrozenDocumentException if the voucher is Paid or Reversed
     * @throws IllegalTransitionException if the voucher is Cancelled or Rejected
     */
    public void assertEditable(PaymentVoucher voucher) {
        VoucherStatus status = voucher.getStatus();
        if (status.isFrozen()) {
            throw new FrozenDocumentException(voucher.getVoucherNo(), status);
        }
        if (!status.isEditable()) {
            throw new IllegalTransitionException(
                "Voucher " + voucher.getVoucherNo() + " is " + status.getLabel() + " and cannot be edited",
                status, status);
        }
    }

    private PaymentVoucher prepare(PaymentVoucher voucher) {
        documentValidator.validate(voucher);

        Money total = voucher.getTotalAmount();
        if (!total.getCurrency().equals(voucher.getCurrency())) {
            throw new ValidationException(
                "Total amount is not in voucher currency " + voucher.getCurrency(), "currency");
        }
        if (!total.isPositive()) {
            throw new ValidationException("Total amount must be greater than 0", "totalAmount");
        }
        for (VoucherLine line : voucher.getLines()) {
            if (line.getAmount().isNegative()) {
                throw new ValidationException("negative amount", "lines.amount");
            }
            if (!line.getAmount().getCurrency().equals(voucher.getCurrency())) {
                throw new ValidationException(
                    "Line " + line.getLineNo() + " is not in voucher currency " + voucher.getCurrency(), "currency");
            }
        }

        PaymentVoucher result = voucher.copy();

        List<VoucherLine> lines = costCenterService.copyToLines(
            result.getCostCenters(), result.getLines(), result.isCopyCostCenters());
        List<VoucherLine> taxed = new ArrayList<>(lines.size());
        for (VoucherLine line : lines) {
            taxed.add(voucherBalancingService.recomputeLineTax(line));
        }
        result.setLines(taxed);

        applyHeaderTax(result);

        voucherBalancingService.requireBalanced(result);
        return result;
    }

    private void applyHeaderTax(PaymentVoucher voucher) {
        BigDecimal percentage = voucher.getTaxPercentage();
        if (percentage == null && voucher.getTaxId() != null) {
            percentage = taxCalculationService.resolveTaxCode(voucher.getTaxId()).getRatePercent();
            voucher.setTaxPercentage(percentage);
        }

        Money total = voucher.getTotalAmount();
        if (percentage == null) {
            voucher.setTaxAmount(null);
            voucher.setBaseAmount(total);
            return;
        }

        Money tax = taxCalculationService.computeTax(total, percentage, voucher.isTaxInclusive());
        voucher.setTaxAmount(tax);
        voucher.setBaseAmount(voucher.isTaxInclusive() ? total.minus(tax) : total);
    }

    private static Money negate(Money amount) {
        return amount != null ? amount.negate() : null;
    }
}
