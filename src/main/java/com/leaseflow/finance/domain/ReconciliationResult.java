package com.leaseflow.finance.domain;

public record ReconciliationResult(Invoice invoice, PaymentSummary summary) {}
