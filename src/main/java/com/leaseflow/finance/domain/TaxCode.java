package com.leaseflow.finance.domain;

import java.math.BigDecimal;

/**
 * A tax master entry. The rate is a percentage, e.g. 5 for 5% VAT.
 */
public class TaxCode {

    private Long taxId;
    private String name;
    private BigDecimal ratePercent;
    private boolean active = true;

    public TaxCode() {
    }

    public TaxCode(Long taxId, String name, BigDecimal ratePercent) {
        this.taxId = taxId;
        this.name = name;
        this.ratePercent = ratePercent;
    }

    public Long getTaxId() {
        return taxId;
    }

    public void setTaxId(Long taxId) {
        this.taxId = taxId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public BigDecimal getRatePercent() {
        return ratePercent;
    }

    public void setRatePercent(BigDecimal ratePercent) {
        this.ratePercent = ratePercent;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
