package com.leaseflow.finance.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * A single account line of a payment voucher.
 * Cost centers set on the line override the voucher header's.
 */
public class VoucherLine {

    private int lineNo;

    @NotNull
    private Long accountId;

    @Size(max = 500)
    private String description;

    @NotNull
    private Money amount;

    private Long taxId;

    @DecimalMin("0")
    private BigDecimal taxPercentage;

    private Money taxAmount;

    @NotNull
    private CostCenterSelection costCenters = CostCenterSelection.EMPTY;

    public VoucherLine() {
    }

    public VoucherLine(Long accountId, Money amount) {
        this.accountId = accountId;
        this.amount = amount;
    }

    public VoucherLine(VoucherLine source) {
        this.lineNo = source.lineNo;
        this.accountId = source.accountId;
        this.description = source.description;
        this.amount = source.amount;
        this.taxId = source.taxId;
        this.taxPercentage = source.taxPercentage;
        this.taxAmount = source.taxAmount;
        this.costCenters = source.costCenters;
    }

    public VoucherLine copy() {
        return new VoucherLine(this);
    }

    public boolean hasCostCenterOverride() {
        return costCenters != null && !costCenters.isEmpty();
    }

    public int getLineNo() {
        return lineNo;
    }

    public void setLineNo(int lineNo) {
        this.lineNo = lineNo;
    }

    public Long getAccountId() {
        return accountId;
    }

    public void setAccountId(Long accountId) {
        this.accountId = accountId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Money getAmount() {
        return amount;
    }

    public void setAmount(Money amount) {
        this.amount = amount;
    }

    public Long getTaxId() {
        return taxId;
    }

    public void setTaxId(Long taxId) {
        this.taxId = taxId;
    }

    public BigDecimal getTaxPercentage() {
        return taxPercentage;
    }

    public void setTaxPercentage(BigDecimal taxPercentage) {
        this.taxPercentage = taxPercentage;
    }

    public Money getTaxAmount() {
        return taxAmount;
    }

    public void setTaxAmount(Money taxAmount) {
        this.taxAmount = taxAmount;
    }

    public CostCenterSelection getCostCenters() {
        return costCenters;
    }

    public void setCostCenters(CostCenterSelection costCenters) {
        this.costCenters = costCenters != null ? costCenters : CostCenterSelection.EMPTY;
    }
}
