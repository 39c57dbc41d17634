package com.leaseflow.finance.domain;

/**
 * Supporting document attached to a payment voucher. Storage is handled by the caller; the
 * engine only carries the reference along.
 */
public record VoucherAttachment(Long docTypeId, String documentName, String storageKey, String description) {}
