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
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaxCalculationService.
 * Covers:
 * - Tax-exclusive calculations (tax on top of the amount)
 * - Tax-inclusive calculations (tax extracted from the amount)
 * - Rounding rules (half-up to the currency's precision)
 * - Tax code lookup
 */
@ExtendWith(MockitoExtension.class)
class TaxCalculationServiceTest {

    @Mock
    private TaxCodeRepository taxCodeRepository;

    private TaxCalculationService taxCalculationService;

    private TaxCode vat;

    @BeforeEach
    void setUp() {
        taxCalculationService = new TaxCalculationService(taxCodeRepository);

        // UAE VAT 5%
        vat = new TaxCode(5L, "VAT 5%", new BigDecimal("5"));
    }

    @Test
    void computeTax_exclusive_calculatesOnTop() {
        Money tax = taxCalculationService.computeTax(Money.of("1000.00", "AED"), new BigDecimal("10"), false);

        assertEquals(Money.of("100.00", "AED"), tax);
    }

    @Test
    void computeTax_inclusive_extractsTaxFromGross() {
        // 1050 * 5 / 105 = 50
        Money tax = taxCalculationService.computeTax(Money.of("1050.00", "AED"), new BigDecimal("5"), true);

        assertEquals(Money.of("50.00", "AED"), tax);
    }

    @Test
    void computeTax_withRounding_roundsHalfUp() {
        // 15% of 33.33 = 4.9995, rounds to 5.00
        Money tax = taxCalculationService.computeTax(Money.of("33.33", "AED"), new BigDecimal("15"), false);

        assertEquals(Money.of("5.00", "AED"), tax);
    }

    @Test
    void computeTax_threeDecimalCurrency_usesThreePlaces() {
        // 5% of 10.123 KWD = 0.50615, rounds to 0.506
        Money tax = taxCalculationService.computeTax(Money.of("10.123", "KWD"), new BigDecimal("5"), false);

        assertEquals(new BigDecimal("0.506"), tax.toDecimal());
    }

    @Test
    void computeTax_zeroRate_returnsZero() {
        Money tax = taxCalculationService.computeTax(Money.of("1000.00", "AED"), BigDecimal.ZERO, true);

        assertTrue(tax.isZero());
        assertEquals("AED", tax.getCurrency());
    }

    @Test
    void computeTax_negativeRate_throwsInvalidRate() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> taxCalculationService.computeTax(Money.of("100.00", "AED"), new BigDecimal("-5"), false));

        assertEquals("INVALID_RATE", ex.getCode());
        assertEquals("taxPercentage", ex.getField());
    }

    @Test
    void extractTaxableAmount_addsBackToInclusiveAmount() {
        Money gross = Money.of("99.99", "AED");
        BigDecimal rate = new BigDecimal("5");

        Money taxable = taxCalculationService.extractTaxableAmount(gross, rate);
        Money tax = taxCalculationService.computeTax(gross, rate, true);

        assertEquals(gross, taxable.plus(tax));
        assertEquals(Money.of("95.23", "AED"), taxable);
    }

    @Test
    void computeTax_byTaxId_usesTaxCodeRate() {
        when(taxCodeRepository.findById(5L)).thenReturn(Optional.of(vat));

        Money tax = taxCalculationService.computeTax(Money.of("200.00", "AED"), 5L);

        assertEquals(Money.of("10.00", "AED"), tax);
    }

    @Test
    void resolveTaxCode_unknownTax_throws() {
        when(taxCodeRepository.findById(99L)).thenReturn(Optional.empty());

        ValidationException ex = assertThrows(ValidationException.class,
            () -> taxCalculationService.resolveTaxCode(99L));

        assertEquals("taxId", ex.getField());
    }

    @Test
    void resolveTaxCode_inactiveTax_throws() {
        vat.setActive(false);
        when(taxCodeRepository.findById(5L)).thenReturn(Optional.of(vat));

        assertThrows(ValidationException.class, () -> taxCalculationService.resolveTaxCode(5L));
    }
}
