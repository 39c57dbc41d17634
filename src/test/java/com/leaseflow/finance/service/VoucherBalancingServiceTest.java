package com.leaseflow.finance.service;

import com.leaseflow.finance.config.FinanceEngineProperties;
import com.leaseflow.finance.domain.*;
import com.leaseflow.finance.exception.OutOfBalanceException;
import com.leaseflow.finance.exception.ValidationException;
import com.leaseflow.finance.repository.TaxCodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static com.leaseflow.finance.service.TestDocuments.AED;
import static com.leaseflow.finance.service.TestDocuments.voucher;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VoucherBalancingServiceTest {

    @Mock
    private TaxCodeRepository taxCodeRepository;

    private FinanceEngineProperties properties;

    private VoucherBalancingService balancingService;

    @BeforeEach
    void setUp() {
        properties = new FinanceEngineProperties();
        balancingService = new VoucherBalancingService(new TaxCalculationService(taxCodeRepository), properties);
    }

    @Test
    void validate_linesShortByOneFils_isOutOfBalance() {
        PaymentVoucher voucher = voucher("500.00", "300.00", "199.99");

        BalanceCheck check = balancingService.validate(voucher);

        assertFalse(check.balanced());
        assertEquals(Money.of("0.01", AED), check.difference());
        assertEquals(Money.of("499.99", AED), check.lineTotal());
    }

    @Test
    void validate_linesMatchTotal_isBalanced() {
        PaymentVoucher voucher = voucher("500.00", "300.00", "200.00");

        BalanceCheck check = balancingService.validate(voucher);

        assertTrue(check.balanced());
        assertTrue(check.difference().isZero());
    }

    @Test
    void validate_linesExceedTotal_hasNegativeDifference() {
        BalanceCheck check = balancingService.validate(voucher("500.00", "300.00", "250.00"));

        assertFalse(check.balanced());
        assertEquals(Money.of("-50.00", AED), check.difference());
    }

    @Test
    void validate_withinConfiguredTolerance_isBalanced() {
        properties.setBalanceToleranceMinorUnits(1);

        assertTrue(balancingService.validate(voucher("500.00", "300.00", "199.99")).balanced());
        assertFalse(balancingService.validate(voucher("500.00", "300.00", "199.98")).balanced());
    }

    @Test
    void validate_noLines_isOutOfBalanceByTotal() {
        BalanceCheck check = balancingService.validate(voucher("500.00"));

        assertEquals(Money.of("500.00", AED), check.difference());
    }

    @Test
    void validate_lineInOtherCurrency_throws() {
        PaymentVoucher voucher = voucher("500.00", "500.00");
        voucher.getLines().get(0).setAmount(Money.of("500.00", "USD"));

        assertThrows(ValidationException.class, () -> balancingService.validate(voucher));
    }

    @Test
    void requireBalanced_outOfBalance_throwsWithDifference() {
        OutOfBalanceException ex = assertThrows(OutOfBalanceException.class,
            () -> balancingService.requireBalanced(voucher("500.00", "300.00", "199.99")));

        assertEquals(Money.of("0.01", AED), ex.getDifference());
        assertEquals("OUT_OF_BALANCE", ex.getCode());
    }

    @Test
    void recomputeLineTax_usesLinePercentage() {
        VoucherLine line = new VoucherLine(4000L, Money.of("200.00", AED));
        line.setTaxPercentage(new BigDecimal("5"));

        VoucherLine taxed = balancingService.recomputeLineTax(line);

        assertEquals(Money.of("10.00", AED), taxed.getTaxAmount());
        assertNull(line.getTaxAmount());
    }

    @Test
    void recomputeLineTax_taxIdOnly_takesRateFromTaxCode() {
        when(taxCodeRepository.findById(5L))
            .thenReturn(Optional.of(new TaxCode(5L, "VAT 5%", new BigDecimal("5"))));
        VoucherLine line = new VoucherLine(4000L, Money.of("100.00", AED));
        line.setTaxId(5L);

        VoucherLine taxed = balancingService.recomputeLineTax(line);

        assertEquals(new BigDecimal("5"), taxed.getTaxPercentage());
        assertEquals(Money.of("5.00", AED), taxed.getTaxAmount());
    }

    @Test
    void recomputeLineTax_noTax_clearsTaxAmount() {
        VoucherLine line = new VoucherLine(4000L, Money.of("100.00", AED));
        line.setTaxAmount(Money.of("5.00", AED));

        assertNull(balancingService.recomputeLineTax(line).getTaxAmount());
    }
}
