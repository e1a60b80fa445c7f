package com.flagship.debt_ledger.repayment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * PostgreSQL-backed repayment log storage (the default).
 */
@Component
@ConditionalOnProperty(name = "debt.repayment-log.storage", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaRepaymentLogStorage implements RepaymentLogStorage {

    private final StoredDocumentRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<String> read(String key) {
        return repository.findById(key).map(StoredDocumentEntity::getPayload);
    }

    @Override
    @Transactional
    public void write(String key, String document) {
        StoredDocumentEntity entity = repository.findById(key)
            .orElseGet(() -> StoredDocumentEntity.of(key, document));
        entity.replacePayload(document);
        repository.save(entity);
        log.debug("Stored document under key {}", key);
    }

    @Override
    @Transactional
    public void delete(String key) {
        if (repository.existsById(key)) {
            repository.deleteById(key);
            log.debug("Deleted document under key {}", key);
        }
    }
}
