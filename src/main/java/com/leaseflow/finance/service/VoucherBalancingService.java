package com.leaseflow.finance.service;

import com.leaseflow.finance.config.FinanceEngineProperties;
import com.leaseflow.finance.domain.BalanceCheck;
import com.leaseflow.finance.domain.Money;
import com.leaseflow.finance.domain.PaymentVoucher;
import com.leaseflow.finance.domain.VoucherLine;
import com.leaseflow.finance.exception.OutOfBalanceException;
import com.leaseflow.finance.exception.ValidationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Checks that a payment voucher's lines add up to its header total, and computes line tax.
 */
@Service
public class VoucherBalancingService {

    private final TaxCalculationService taxCalculationService;
    private final FinanceEngineProperties properties;

    public VoucherBalancingService(TaxCalculationService taxCalculationService,
                                   FinanceEngineProperties properties) {
        this.taxCalculationService = taxCalculationService;
        this.properties = properties;
    }

    /**
     * Compares the sum of the line amounts with the header total.
     * The difference is total minus line total, so a positive difference means the lines are short.
     *
     * @throws ValidationException if the voucher has no total or a line is in another currency
     */
    public BalanceCheck validate(PaymentVoucher voucher) {
        Money total = voucher.getTotalAmount();
        if (total == null) {
            throw new ValidationException("Total amount is required", "totalAmount");
        }

        Money lineTotal = total.withAmount(BigDecimal.ZERO);
        for (VoucherLine line : voucher.getLines()) {
            if (line.getAmount() == null) {
                throw new ValidationException("Line " + line.getLineNo() + " has no amount", "lines.amount");
            }
            lineTotal = lineTotal.plus(line.getAmount());
        }

        Money difference = total.minus(lineTotal);
        boolean balanced = Math.abs(difference.getMinorUnits()) <= properties.getBalanceToleranceMinorUnits();
        return new BalanceCheck(balanced, total, lineTotal, difference);
    }

    /**
     * @throws OutOfBalanceException if the lines do not add up to the total
     */
    public BalanceCheck requireBalanced(PaymentVoucher voucher) {
        BalanceCheck check = validate(voucher);
        if (!check.balanced()) {
            throw new OutOfBalanceException(check.difference());
        }
        return check;
    }

    /**
     * Recomputes a line's exclusive tax from its amount and tax percentage. When only a TaxID is
     * set, the percentage is taken from the tax code. A line without either has no tax.
     *
     * @return a copy of the line; only this line is affected
     */
    public VoucherLine recomputeLineTax(VoucherLine line) {
        VoucherLine result = line.copy();

        BigDecimal percentage = result.getTaxPercentage();
        if (percentage == null && result.getTaxId() != null) {
            percentage = taxCalculationService.resolveTaxCode(result.getTaxId()).getRatePercent();
            result.setTaxPercentage(percentage);
        }

        if (percentage == null) {
            result.setTaxAmount(null);
        } else {
            result.setTaxAmount(taxCalculationService.computeTax(result.getAmount(), percentage, false));
        }
        return result;
    }
}
