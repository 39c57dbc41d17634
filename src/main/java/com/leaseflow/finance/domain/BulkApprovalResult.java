package com.leaseflow.finance.domain;

import java.util.List;
import java.util.Map;

/**
 * Outcome of approving or rejecting several invoices at once. Each invoice succeeds or fails on
 * its own; {@code failures} maps the invoice number to the reason it was refused.
 */
public record BulkApprovalResult(List<Invoice> processed, Map<String, String> failures) {

    public int processedCount() {
        return processed.size();
    }

    public int failedCount() {
        return failures.size();
    }
}
