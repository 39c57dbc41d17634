package com.leaseflow.finance.domain;

import com.leaseflow.finance.exception.FrozenDocumentException;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

/**
 * A payment received against a lease invoice.
 * The received amount is fixed once the receipt has cleared.
 */
public class Receipt {

    @NotNull
    private Long receiptId;

    private String receiptNo;

    private Long invoiceId;

    @NotNull
    private Money receivedAmount;

    @NotNull
    private ReceiptStatus status = ReceiptStatus.RECEIVED;

    private LocalDate receiptDate;

    private LocalDate clearanceDate;

    // Constructors
    public Receipt() {
    }

    public Receipt(Long receiptId, Long invoiceId, Money receivedAmount, ReceiptStatus status) {
        this.receiptId = receiptId;
        this.invoiceId = invoiceId;
        this.receivedAmount = receivedAmount;
        this.status = status;
    }

    public boolean isCleared() {
        return status == ReceiptStatus.CLEARED;
    }

    // Getters and Setters
    public Long getReceiptId() {
        return receiptId;
    }

    public void setReceiptId(Long receiptId) {
        this.receiptId = receiptId;
    }

    public String getReceiptNo() {
        return receiptNo;
    }

    public void setReceiptNo(String receiptNo) {
        this.receiptNo = receiptNo;
    }

    public Long getInvoiceId() {
        return invoiceId;
    }

    public void setInvoiceId(Long invoiceId) {
        this.invoiceId = invoiceId;
    }

    public Money getReceivedAmount() {
        return receivedAmount;
    }

    public void setReceivedAmount(Money receivedAmount) {
        if (isCleared() && this.receivedAmount != null && !this.receivedAmount.equals(receivedAmount)) {
            throw new FrozenDocumentException(receiptNo != null ? receiptNo : String.valueOf(receiptId), status);
        }
        this.receivedAmount = receivedAmount;
    }

    public ReceiptStatus getStatus() {
        return status;
    }

    public void setStatus(ReceiptStatus status) {
        this.status = status;
    }

    public LocalDate getReceiptDate() {
        return receiptDate;
    }

    public void setReceiptDate(LocalDate receiptDate) {
        this.receiptDate = receiptDate;
    }

    public LocalDate getClearanceDate() {
        return clearanceDate;
    }

    public void setClearanceDate(LocalDate clearanceDate) {
        this.clearanceDate = clearanceDate;
    }
}
