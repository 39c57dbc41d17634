package com.leaseflow.finance.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A payment voucher paying a supplier, split over one or more account lines.
 *
 * The lines must add up to the header total. The voucher can be edited while DRAFT or PENDING;
 * once PAID it is frozen and can only be undone by a reversal voucher.
 */
public class PaymentVoucher {

    @Size(max = 50)
    private String voucherNo;

    @NotNull
    private LocalDate transactionDate;

    private LocalDate postingDate;

    private Long supplierId;

    @NotNull
    private PaymentInstrument paymentInstrument;

    @NotNull
    private VoucherStatus status = VoucherStatus.DRAFT;

    @NotNull
    private Money totalAmount;

    @NotBlank
    @Size(max = 3)
    private String currency;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal exchangeRate = BigDecimal.ONE;

    // Header cost centers, copied down to lines when copyCostCenters is set
    @NotNull
    private CostCenterSelection costCenters = CostCenterSelection.EMPTY;

    private boolean copyCostCenters;

    // Header tax
    private Long taxId;

    @DecimalMin("0")
    private BigDecimal taxPercentage;

    private boolean taxInclusive;

    private Money taxAmount;

    private Money baseAmount;

    @Size(max = 500)
    private String description;

    @Size(max = 1000)
    private String narration;

    // Voucher number of the voucher this one reverses
    @Size(max = 50)
    private String reversalOf;

    @Valid
    private List<VoucherLine> lines = new ArrayList<>();

    private List<VoucherAttachment> attachments = new ArrayList<>();

    // Constructors
    public PaymentVoucher() {
    }

    public PaymentVoucher(String voucherNo, LocalDate transactionDate, PaymentInstrument paymentInstrument,
                          Money totalAmount) {
        this.voucherNo = voucherNo;
        this.transactionDate = transactionDate;
        this.paymentInstrument = paymentInstrument;
        this.totalAmount = totalAmount;
        this.currency = totalAmount.getCurrency();
        this.exchangeRate = totalAmount.getExchangeRate();
    }

    /**
     * Deep copy; lines are copied, attachments are immutable references.
     */
    public PaymentVoucher(PaymentVoucher source) {
        this.voucherNo = source.voucherNo;
        this.transactionDate = source.transactionDate;
        this.postingDate = source.postingDate;
        this.supplierId = source.supplierId;
        this.paymentInstrument = source.paymentInstrument;
        this.status = source.status;
        this.totalAmount = source.totalAmount;
        this.currency = source.currency;
        this.exchangeRate = source.exchangeRate;
        this.costCenters = source.costCenters;
        this.copyCostCenters = source.copyCostCenters;
        this.taxId = source.taxId;
        this.taxPercentage = source.taxPercentage;
        this.taxInclusive = source.taxInclusive;
        this.taxAmount = source.taxAmount;
        this.baseAmount = source.baseAmount;
        this.description = source.description;
        this.narration = source.narration;
        this.reversalOf = source.reversalOf;
        this.lines = new ArrayList<>();
        for (VoucherLine line : source.lines) {
            this.lines.add(line.copy());
        }
        this.attachments = new ArrayList<>(source.attachments);
    }

    // Helper methods
    public PaymentVoucher copy() {
        return new PaymentVoucher(this);
    }

    public void addLine(VoucherLine line) {
        lines.add(line);
        line.setLineNo(lines.size());
    }

    public PaymentType getPaymentType() {
        return paymentInstrument != null ? paymentInstrument.getType() : null;
    }

    public boolean isReversal() {
        return reversalOf != null;
    }

    // Getters and Setters
    public String getVoucherNo() {
        return voucherNo;
    }

    public void setVoucherNo(String voucherNo) {
        this.voucherNo = voucherNo;
    }

    public LocalDate getTransactionDate() {
        return transactionDate;
    }

    public void setTransactionDate(LocalDate transactionDate) {
        this.transactionDate = transactionDate;
    }

    public LocalDate getPostingDate() {
        return postingDate;
    }

    public void setPostingDate(LocalDate postingDate) {
        this.postingDate = postingDate;
    }

    public Long getSupplierId() {
        return supplierId;
    }

    public void setSupplierId(Long supplierId) {
        this.supplierId = supplierId;
    }

    public PaymentInstrument getPaymentInstrument() {
        return paymentInstrument;
    }

    public void setPaymentInstrument(PaymentInstrument paymentInstrument) {
        this.paymentInstrument = paymentInstrument;
    }

    public VoucherStatus getStatus() {
        return status;
    }

    public void setStatus(VoucherStatus status) {
        this.status = status;
    }

    public Money getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(Money totalAmount) {
        this.totalAmount = totalAmount;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public BigDecimal getExchangeRate() {
        return exchangeRate;
    }

    public void setExchangeRate(BigDecimal exchangeRate) {
        this.exchangeRate = exchangeRate;
    }

    public CostCenterSelection getCostCenters() {
        return costCenters;
    }

    public void setCostCenters(CostCenterSelection costCenters) {
        this.costCenters = costCenters != null ? costCenters : CostCenterSelection.EMPTY;
    }

    public boolean isCopyCostCenters() {
        return copyCostCenters;
    }

    public void setCopyCostCenters(boolean copyCostCenters) {
        this.copyCostCenters = copyCostCenters;
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

    public boolean isTaxInclusive() {
        return taxInclusive;
    }

    public void setTaxInclusive(boolean taxInclusive) {
        this.taxInclusive = taxInclusive;
    }

    public Money getTaxAmount() {
        return taxAmount;
    }

    public void setTaxAmount(Money taxAmount) {
        this.taxAmount = taxAmount;
    }

    public Money getBaseAmount() {
        return baseAmount;
    }

    public void setBaseAmount(Money baseAmount) {
        this.baseAmount = baseAmount;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getNarration() {
        return narration;
    }

    public void setNarration(String narration) {
        this.narration = narration;
    }

    public String getReversalOf() {
        return reversalOf;
    }

    public void setReversalOf(String reversalOf) {
        this.reversalOf = reversalOf;
    }

    public List<VoucherLine> getLines() {
        return lines;
    }

    public void setLines(List<VoucherLine> lines) {
        this.lines = lines;
    }

    public List<VoucherAttachment> getAttachments() {
        return attachments;
    }

    public void setAttachments(List<VoucherAttachment> attachments) {
        this.attachments = attachments;
    }
}
