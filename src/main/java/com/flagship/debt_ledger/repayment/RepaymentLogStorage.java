package com.flagship.debt_ledger.repayment;

import java.util.Optional;

/**
 * Key-value persistence for serialized repayment logs.
 *
 * Implementations propagate I/O failures as unchecked exceptions
 * (Spring {@code DataAccessException}); callers decide whether to retry.
 */
public interface RepaymentLogStorage {

    /**
     * @return The stored document, or empty if nothing is stored under {@code key}
     */
    Optional<String> read(String key);

    /**
     * Stores {@code document} under {@code key}, replacing any previous value.
     */
    void write(String key, String document);

    /**
     * Deletes whatever is stored under {@code key}. No-op when absent.
     */
    void delete(String key);
}
