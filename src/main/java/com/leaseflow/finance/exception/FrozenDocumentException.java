package com.leaseflow.finance.exception;

/**
 * Mutation attempted on a document that can only be changed through a reversal.
 */
public class FrozenDocumentException extends FinanceEngineException {

    private final String documentNo;
    private final String status;

    public FrozenDocumentException(String documentNo, Enum<?> status) {
        super("Document " + documentNo + " is " + status + " and can no longer be modified", "FROZEN");
        this.documentNo = documentNo;
        this.status = status != null ? status.name() : null;
    }

    public String getDocumentNo() {
        return documentNo;
    }

    public String getStatus() {
        return status;
    }
}
