package com.leaseflow.finance.repository;

import com.leaseflow.finance.domain.TaxCode;

import java.util.Optional;

/**
 * Lookup of the tax master. Implemented by the application's persistence layer.
 */
public interface TaxCodeRepository {

    Optional<TaxCode> findById(Long taxId);
}
