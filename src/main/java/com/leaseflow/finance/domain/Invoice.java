package com.leaseflow.finance.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A lease invoice issued to a customer.
 * Workflow: DRAFT → PENDING/SENT → PARTIAL → PAID, with OVERDUE and CANCELLED on the side.
 *
 * SubTotal, TaxAmount, DiscountAmount and PaidAmount are inputs; TotalAmount and BalanceAmount
 * are derived by the computation service and should never be set by callers directly.
 * All amounts are held in the invoice currency and carry the invoice's exchange rate.
 */
public class Invoice {

    private Long invoiceId;

    @NotBlank
    @Size(max = 50)
    private String invoiceNo;

    @NotNull
    private InvoiceType invoiceType = InvoiceType.REGULAR;

    @NotNull
    private InvoiceStatus status = InvoiceStatus.DRAFT;

    private Long customerId;

    private Long contractId;

    @NotNull
    private LocalDate invoiceDate;

    @NotNull
    private LocalDate dueDate;

    private LocalDate periodFromDate;

    private LocalDate periodToDate;

    @NotBlank
    @Size(max = 3)
    private String currency;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal exchangeRate = BigDecimal.ONE;

    private Long taxId;

    @NotNull
    private Money subTotal;

    @NotNull
    private Money taxAmount;

    @NotNull
    private Money discountAmount;

    @NotNull
    private Money totalAmount;

    @NotNull
    private Money paidAmount;

    @NotNull
    private Money balanceAmount;

    // Recurrence
    private boolean recurring;

    private RecurrencePattern recurrencePattern;

    private LocalDate nextInvoiceDate;

    // Invoice number of the first invoice in a recurring series
    @Size(max = 50)
    private String sourceInvoiceNo;

    @Size(max = 1000)
    private String notes;

    // Approval
    private boolean requiresApproval;

    @NotNull
    private ApprovalStatus approvalStatus = ApprovalStatus.PENDING;

    @Size(max = 100)
    private String approvedBy;

    private LocalDateTime approvedOn;

    @Size(max = 500)
    private String approvalComments;

    @Size(max = 500)
    private String rejectionReason;

    // Constructors
    public Invoice() {
    }

    public Invoice(String invoiceNo, String currency, LocalDate invoiceDate, LocalDate dueDate) {
        this.invoiceNo = invoiceNo;
        this.currency = currency;
        this.invoiceDate = invoiceDate;
        this.dueDate = dueDate;
        Money zero = Money.zero(currency, exchangeRate);
        this.subTotal = zero;
        this.taxAmount = zero;
        this.discountAmount = zero;
        this.totalAmount = zero;
        this.paidAmount = zero;
        this.balanceAmount = zero;
    }

    /**
     * Copy constructor. Money is immutable, so a field-by-field copy is a full copy.
     */
    public Invoice(Invoice source) {
        this.invoiceId = source.invoiceId;
        this.invoiceNo = source.invoiceNo;
        this.invoiceType = source.invoiceType;
        this.status = source.status;
        this.customerId = source.customerId;
        this.contractId = source.contractId;
        this.invoiceDate = source.invoiceDate;
        this.dueDate = source.dueDate;
        this.periodFromDate = source.periodFromDate;
        this.periodToDate = source.periodToDate;
        this.currency = source.currency;
        this.exchangeRate = source.exchangeRate;
        this.taxId = source.taxId;
        this.subTotal = source.subTotal;
        this.taxAmount = source.taxAmount;
        this.discountAmount = source.discountAmount;
        this.totalAmount = source.totalAmount;
        this.paidAmount = source.paidAmount;
        this.balanceAmount = source.balanceAmount;
        this.recurring = source.recurring;
        this.recurrencePattern = source.recurrencePattern;
        this.nextInvoiceDate = source.nextInvoiceDate;
        this.sourceInvoiceNo = source.sourceInvoiceNo;
        this.notes = source.notes;
        this.requiresApproval = source.requiresApproval;
        this.approvalStatus = source.approvalStatus;
        this.approvedBy = source.approvedBy;
        this.approvedOn = source.approvedOn;
        this.approvalComments = source.approvalComments;
        this.rejectionReason = source.rejectionReason;
    }

    // Helper methods
    public Invoice copy() {
        return new Invoice(this);
    }

    /**
     * Creates an amount in this invoice's currency and exchange rate.
     */
    public Money money(BigDecimal amount) {
        return Money.of(amount, currency, exchangeRate);
    }

    public Money money(String amount) {
        return money(new BigDecimal(amount));
    }

    public boolean isDraft() {
        return status == InvoiceStatus.DRAFT;
    }

    public boolean isPaid() {
        return status == InvoiceStatus.PAID;
    }

    public boolean isCancelled() {
        return status == InvoiceStatus.CANCELLED;
    }

    public boolean isApproved() {
        return approvalStatus == ApprovalStatus.APPROVED;
    }

    /**
     * Invoice number of the first invoice in the recurring series this one belongs to.
     */
    public String getRecurrenceRootNo() {
        return sourceInvoiceNo != null ? sourceInvoiceNo : invoiceNo;
    }

    // Getters and Setters
    public Long getInvoiceId() {
        return invoiceId;
    }

    public void setInvoiceId(Long invoiceId) {
        this.invoiceId = invoiceId;
    }

    public String getInvoiceNo() {
        return invoiceNo;
    }

    public void setInvoiceNo(String invoiceNo) {
        this.invoiceNo = invoiceNo;
    }

    public InvoiceType getInvoiceType() {
        return invoiceType;
    }

    public void setInvoiceType(InvoiceType invoiceType) {
        this.invoiceType = invoiceType;
    }

    public InvoiceStatus getStatus() {
        return status;
    }

    public void setStatus(InvoiceStatus status) {
        this.status = status;
    }

    public Long getCustomerId() {
        return customerId;
    }

    public void setCustomerId(Long customerId) {
        this.customerId = customerId;
    }

    public Long getContractId() {
        return contractId;
    }

    public void setContractId(Long contractId) {
        this.contractId = contractId;
    }

    public LocalDate getInvoiceDate() {
        return invoiceDate;
    }

    public void setInvoiceDate(LocalDate invoiceDate) {
        this.invoiceDate = invoiceDate;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public LocalDate getPeriodFromDate() {
        return periodFromDate;
    }

    public void setPeriodFromDate(LocalDate periodFromDate) {
        this.periodFromDate = periodFromDate;
    }

    public LocalDate getPeriodToDate() {
        return periodToDate;
    }

    public void setPeriodToDate(LocalDate periodToDate) {
        this.periodToDate = periodToDate;
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

    /**
     * Sets the exchange rate and re-rates every amount already held on the invoice.
     */
    public void setExchangeRate(BigDecimal exchangeRate) {
        this.exchangeRate = exchangeRate;
        if (exchangeRate == null || exchangeRate.signum() <= 0) {
            // Left for bean validation to report
            return;
        }
        this.subTotal = rerate(subTotal);
        this.taxAmount = rerate(taxAmount);
        this.discountAmount = rerate(discountAmount);
        this.totalAmount = rerate(totalAmount);
        this.paidAmount = rerate(paidAmount);
        this.balanceAmount = rerate(balanceAmount);
    }

    private Money rerate(Money amount) {
        return amount != null ? amount.withExchangeRate(exchangeRate) : null;
    }

    public Long getTaxId() {
        return taxId;
    }

    public void setTaxId(Long taxId) {
        this.taxId = taxId;
    }

    public Money getSubTotal() {
        return subTotal;
    }

    public void setSubTotal(Money subTotal) {
        this.subTotal = subTotal;
    }

    public Money getTaxAmount() {
        return taxAmount;
    }

    public void setTaxAmount(Money taxAmount) {
        this.taxAmount = taxAmount;
    }

    public Money getDiscountAmount() {
        return discountAmount;
    }

    public void setDiscountAmount(Money discountAmount) {
        this.discountAmount = discountAmount;
    }

    public Money getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(Money totalAmount) {
        this.totalAmount = totalAmount;
    }

    public Money getPaidAmount() {
        return paidAmount;
    }

    public void setPaidAmount(Money paidAmount) {
        this.paidAmount = paidAmount;
    }

    public Money getBalanceAmount() {
        return balanceAmount;
    }

    public void setBalanceAmount(Money balanceAmount) {
        this.balanceAmount = balanceAmount;
    }

    public boolean isRecurring() {
        return recurring;
    }

    public void setRecurring(boolean recurring) {
        this.recurring = recurring;
    }

    public RecurrencePattern getRecurrencePattern() {
        return recurrencePattern;
    }

    public void setRecurrencePattern(RecurrencePattern recurrencePattern) {
        this.recurrencePattern = recurrencePattern;
    }

    public LocalDate getNextInvoiceDate() {
        return nextInvoiceDate;
    }

    public void setNextInvoiceDate(LocalDate nextInvoiceDate) {
        this.nextInvoiceDate = nextInvoiceDate;
    }

    public String getSourceInvoiceNo() {
        return sourceInvoiceNo;
    }

    public void setSourceInvoiceNo(String sourceInvoiceNo) {
        this.sourceInvoiceNo = sourceInvoiceNo;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public boolean isRequiresApproval() {
        return requiresApproval;
    }

    public void setRequiresApproval(boolean requiresApproval) {
        this.requiresApproval = requiresApproval;
    }

    public ApprovalStatus getApprovalStatus() {
        return approvalStatus;
    }

    public void setApprovalStatus(ApprovalStatus approvalStatus) {
        this.approvalStatus = approvalStatus;
    }

    public String getApprovedBy() {
        return approvedBy;
    }

    public void setApprovedBy(String approvedBy) {
        this.approvedBy = approvedBy;
    }

    public LocalDateTime getApprovedOn() {
        return approvedOn;
    }

    public void setApprovedOn(LocalDateTime approvedOn) {
        this.approvedOn = approvedOn;
    }

    public String getApprovalComments() {
        return approvalComments;
    }

    public void setApprovalComments(String approvalComments) {
        this.approvalComments = approvalComments;
    }

    public String getRejectionReason() {
        return rejectionReason;
    }

    public void setRejectionReason(String rejectionReason) {
        this.rejectionReason = rejectionReason;
    }
}
