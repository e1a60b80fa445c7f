package com.flagship.debt_ledger.repayment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for key-addressed JSON documents.
 */
@Repository
public interface StoredDocumentRepository extends JpaRepository<StoredDocumentEntity, String> {
}
