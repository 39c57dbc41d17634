package com.leaseflow.finance.domain;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.leaseflow.finance.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Objects;

/**
 * A monetary amount held as integer minor units of a currency, plus the exchange rate of that
 * currency to the company's base currency.
 *
 * All arithmetic is done on minor units. Conversion to a decimal only happens in
 * {@link #of(BigDecimal, String, BigDecimal)} and {@link #toDecimal()}, rounding half-up to the
 * currency's precision (2 places unless the currency defines otherwise).
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Money implements Comparable<Money> {

    private static final int DEFAULT_SCALE = 2;

    private final long minorUnits;
    private final String currency;
    private final BigDecimal exchangeRate;

    private Money(long minorUnits, String currency, BigDecimal exchangeRate) {
        if (currency == null || currency.isBlank()) {
            throw new ValidationException("Currency is required", "currency");
        }
        if (exchangeRate == null || exchangeRate.signum() <= 0) {
            throw new ValidationException("Exchange rate must be greater than 0", "exchangeRate");
        }
        this.minorUnits = minorUnits;
        this.currency = currency;
        this.exchangeRate = exchangeRate;
    }

    public static Money ofMinor(long minorUnits, String currency) {
        return new Money(minorUnits, currency, BigDecimal.ONE);
    }

    public static Money ofMinor(long minorUnits, String currency, BigDecimal exchangeRate) {
        return new Money(minorUnits, currency, exchangeRate);
    }

    public static Money of(String amount, String currency) {
        return of(new BigDecimal(amount), currency, BigDecimal.ONE);
    }

    public static Money of(BigDecimal amount, String currency) {
        return of(amount, currency, BigDecimal.ONE);
    }

    @JsonCreator
    public static Money of(@JsonProperty("amount") BigDecimal amount,
                           @JsonProperty("currency") String currency,
                           @JsonProperty("exchangeRate") BigDecimal exchangeRate) {
        if (amount == null) {
            throw new ValidationException("Amount is required", "amount");
        }
        int scale = scaleFor(currency);
        long minor = amount.setScale(scale, RoundingMode.HALF_UP).movePointRight(scale).longValueExact();
        return new Money(minor, currency, exchangeRate != null ? exchangeRate : BigDecimal.ONE);
    }

    public static Money zero(String currency) {
        return new Money(0L, currency, BigDecimal.ONE);
    }

    public static Money zero(String currency, BigDecimal exchangeRate) {
        return new Money(0L, currency, exchangeRate);
    }

    /**
     * Number of decimal places of the currency's minor unit.
     */
    public static int scaleFor(String currency) {
        if (currency == null) {
            return DEFAULT_SCALE;
        }
        try {
            int digits = Currency.getInstance(currency).getDefaultFractionDigits();
            return digits >= 0 ? digits : DEFAULT_SCALE;
        } catch (IllegalArgumentException e) {
            // Not an ISO 4217 code, e.g. an internal currency id
            return DEFAULT_SCALE;
        }
    }

    public Money plus(Money other) {
        requireSameCurrency(other);
        return new Money(Math.addExact(minorUnits, other.minorUnits), currency, exchangeRate);
    }

    public Money minus(Money other) {
        requireSameCurrency(other);
        return new Money(Math.subtractExact(minorUnits, other.minorUnits), currency, exchangeRate);
    }

    public Money negate() {
        return new Money(Math.negateExact(minorUnits), currency, exchangeRate);
    }

    public Money abs() {
        return minorUnits < 0 ? negate() : this;
    }

    /**
     * Returns this amount, or zero when it is negative.
     */
    public Money atLeastZero() {
        return minorUnits < 0 ? new Money(0L, currency, exchangeRate) : this;
    }

    /**
     * Multiplies by a decimal factor, rounding half-up to the currency's minor unit.
     */
    public Money multiply(BigDecimal factor) {
        return withAmount(toDecimal().multiply(factor));
    }

    /**
     * Creates an amount in the same currency and exchange rate from a decimal value.
     */
    public Money withAmount(BigDecimal amount) {
        return of(amount, currency, exchangeRate);
    }

    public Money withExchangeRate(BigDecimal rate) {
        return new Money(minorUnits, currency, rate);
    }

    /**
     * Converts to the base currency using this amount's exchange rate.
     */
    public Money toBaseCurrency(String baseCurrency) {
        if (currency.equals(baseCurrency)) {
            return new Money(minorUnits, currency, BigDecimal.ONE);
        }
        return of(toDecimal().multiply(exchangeRate), baseCurrency, BigDecimal.ONE);
    }

    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(minorUnits, scaleFor(currency));
    }

    public boolean isZero() {
        return minorUnits == 0;
    }

    public boolean isPositive() {
        return minorUnits > 0;
    }

    public boolean isNegative() {
        return minorUnits < 0;
    }

    public boolean isSameCurrency(Money other) {
        return other != null && currency.equals(other.currency);
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return Long.compare(minorUnits, other.minorUnits);
    }

    public long getMinorUnits() {
        return minorUnits;
    }

    @JsonProperty("amount")
    public BigDecimal getAmount() {
        return toDecimal();
    }

    @JsonProperty("currency")
    public String getCurrency() {
        return currency;
    }

    @JsonProperty("exchangeRate")
    public BigDecimal getExchangeRate() {
        return exchangeRate;
    }

    private void requireSameCurrency(Money other) {
        if (other == null) {
            throw new ValidationException("Amount is required");
        }
        if (!currency.equals(other.currency)) {
            throw new ValidationException(
                "Currency mismatch: " + currency + " vs " + other.currency, "currency");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money other)) {
            return false;
        }
        return minorUnits == other.minorUnits
            && currency.equals(other.currency)
            && exchangeRate.compareTo(other.exchangeRate) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minorUnits, currency, exchangeRate.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return currency + " " + toDecimal().toPlainString();
    }
}
