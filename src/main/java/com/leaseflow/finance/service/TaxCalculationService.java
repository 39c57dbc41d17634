package com.leaseflow.finance.service;

import com.leaseflow.finance.domain.Money;
import com.leaseflow.finance.domain.TaxCode;
import com.leaseflow.finance.exception.ValidationException;
import com.leaseflow.finance.repository.TaxCodeRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Service for calculating tax amounts on invoices and voucher lines.
 *
 * Handles:
 * - Tax-exclusive amounts: tax = base * rate / 100
 * - Tax-inclusive amounts: tax = base * rate / (100 + rate)
 * - Rounding half-up to the currency's minor unit
 * - Resolving a TaxID to its rate through the tax master
 *
 * Rates are percentages (5 means 5%).
 */
@Service
public class TaxCalculationService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TaxCodeRepository taxCodeRepository;

    public TaxCalculationService(TaxCodeRepository taxCodeRepository) {
        this.taxCodeRepository = taxCodeRepository;
    }

    /**
     * Calculates the tax on an amount.
     *
     * @param base The taxable amount, or the gross amount when inclusive
     * @param ratePercent The tax rate as a percentage
     * @param inclusive Whether base already contains the tax
     * @return The tax amount in the base's currency
     * @throws ValidationException if the rate is negative
     */
    public Money computeTax(Money base, BigDecimal ratePercent, boolean inclusive) {
        if (base == null) {
            throw new ValidationException("Taxable amount is required", "amount");
        }
        if (ratePercent == null || ratePercent.signum() < 0) {
            throw new ValidationException("Tax rate must not be negative: " + ratePercent,
                "INVALID_RATE", "taxPercentage");
        }
        if (ratePercent.signum() == 0) {
            return base.withAmount(BigDecimal.ZERO);
        }

        int scale = Money.scaleFor(base.getCurrency());
        BigDecimal divisor = inclusive ? HUNDRED.add(ratePercent) : HUNDRED;

        BigDecimal tax = base.toDecimal()
                             .multiply(ratePercent)
                             .divide(divisor, scale, RoundingMode.HALF_UP);
        return base.withAmount(tax);
    }

    /**
     * Extracts the taxable (tax-exclusive) amount from a tax-inclusive amount.
     * Taxable plus tax always adds back up to the inclusive amount.
     */
    public Money extractTaxableAmount(Money inclusiveAmount, BigDecimal ratePercent) {
        return inclusiveAmount.minus(computeTax(inclusiveAmount, ratePercent, true));
    }

    /**
     * Looks up an active tax code.
     *
     * @throws ValidationException if the tax is unknown or inactive
     */
    public TaxCode resolveTaxCode(Long taxId) {
        TaxCode taxCode = taxCodeRepository.findById(taxId)
            .orElseThrow(() -> new ValidationException("Unknown tax: " + taxId, "taxId"));

        if (!taxCode.isActive()) {
            throw new ValidationException("Tax is inactive: " + taxCode.getName(), "taxId");
        }
        return taxCode;
    }

    /**
     * Calculates exclusive tax for a TaxID.
     */
    public Money computeTax(Money base, Long taxId) {
        return computeTax(base, resolveTaxCode(taxId).getRatePercent(), false);
    }
}
