package com.leaseflow.finance.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaseflow.finance.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    void of_roundsHalfUpToCurrencyScale() {
        assertEquals(1005L, Money.of("10.045", "AED").getMinorUnits());
        assertEquals(1004L, Money.of("10.044", "AED").getMinorUnits());
    }

    @Test
    void of_usesCurrencyFractionDigits() {
        // JPY has no minor unit, KWD has three
        assertEquals(1001L, Money.of("1000.5", "JPY").getMinorUnits());
        assertEquals(1500L, Money.of("1.5", "KWD").getMinorUnits());
        assertEquals(new BigDecimal("1.500"), Money.of("1.5", "KWD").toDecimal());
    }

    @Test
    void scaleFor_unknownCurrency_defaultsToTwo() {
        assertEquals(2, Money.scaleFor("XYZ1"));
    }

    @Test
    void plusAndMinus_workInMinorUnits() {
        Money a = Money.of("0.10", "AED");
        Money b = Money.of("0.20", "AED");

        assertEquals(Money.of("0.30", "AED"), a.plus(b));
        assertEquals(Money.of("-0.10", "AED"), a.minus(b));
    }

    @Test
    void plus_differentCurrencies_throws() {
        Money aed = Money.of("1.00", "AED");
        Money usd = Money.of("1.00", "USD");

        ValidationException ex = assertThrows(ValidationException.class, () -> aed.plus(usd));
        assertEquals("currency", ex.getField());
    }

    @Test
    void atLeastZero_clampsNegativeAmounts() {
        assertTrue(Money.of("-5.00", "AED").atLeastZero().isZero());
        assertEquals(Money.of("5.00", "AED"), Money.of("5.00", "AED").atLeastZero());
    }

    @Test
    void multiply_roundsToMinorUnit() {
        // 33.33 * 0.15 = 4.9995
        assertEquals(Money.of("5.00", "AED"), Money.of("33.33", "AED").multiply(new BigDecimal("0.15")));
    }

    @Test
    void toBaseCurrency_appliesExchangeRate() {
        Money usd = Money.of(new BigDecimal("100.00"), "USD", new BigDecimal("3.6725"));

        Money aed = usd.toBaseCurrency("AED");

        assertEquals(Money.of("367.25", "AED"), aed);
    }

    @Test
    void exchangeRate_mustBePositive() {
        assertThrows(ValidationException.class,
            () -> Money.of(BigDecimal.TEN, "AED", BigDecimal.ZERO));
    }

    @Test
    void equals_ignoresExchangeRateScale() {
        Money a = Money.ofMinor(100, "USD", new BigDecimal("3.67"));
        Money b = Money.ofMinor(100, "USD", new BigDecimal("3.6700"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void jackson_writesAmountCurrencyAndRate() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        String json = mapper.writeValueAsString(Money.of("1050.00", "AED"));
        Money read = mapper.readValue(json, Money.class);

        assertTrue(json.contains("\"amount\":1050.00"));
        assertTrue(json.contains("\"currency\":\"AED\""));
        assertFalse(json.contains("zero"));
        assertEquals(Money.of("1050.00", "AED"), read);
    }
}
