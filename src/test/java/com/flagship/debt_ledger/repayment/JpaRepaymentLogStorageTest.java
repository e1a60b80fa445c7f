package com.flagship.debt_ledger.repayment;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Repayment log persistence against a real PostgreSQL.
 *
 * Verifies that the document survives the jsonb column, that saves replace
 * the stored row, and that a row corrupted outside the service loads as an
 * empty log.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JpaRepaymentLogStorageTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("debt_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("debt.repayment-log.storage", () -> "jpa");
    }

    @Autowired
    private RepaymentLogStore logStore;

    @Autowired
    private RepaymentLogStorage storage;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("DELETE FROM stored_documents");
    }

    private static RepaymentLogEntry entry(String positionId, int appliedCount, String balance) {
        return new RepaymentLogEntry(positionId, appliedCount, new BigDecimal(balance),
            new BigDecimal("27.291"), new BigDecimal("272.709"), Instant.parse("2025-03-20T09:00:00Z"));
    }

    @Test
    @DisplayName("JPA adapter is selected by default")
    void jpaAdapterSelected() {
        assertInstanceOf(JpaRepaymentLogStorage.class, storage);
    }

    @Test
    @DisplayName("Saved log round-trips through the jsonb column")
    void saveAndLoad() {
        RepaymentLog repaymentLog = RepaymentLog.empty(Instant.now());
        repaymentLog.put(entry("card-1", 3, "727.291"));
        logStore.save(repaymentLog);

        RepaymentLogEntry loaded = logStore.entry("card-1").orElseThrow();

        assertEquals(3, loaded.getAppliedCount());
        assertEquals(0, new BigDecimal("727.291").compareTo(loaded.getCachedBalance()));
        assertEquals(0, new BigDecimal("272.709").compareTo(loaded.getCumulativePrincipal()));
    }

    @Test
    @DisplayName("Saving again replaces the single stored row")
    void saveReplaces() {
        RepaymentLog repaymentLog = RepaymentLog.empty(Instant.now());
        repaymentLog.put(entry("card-1", 3, "727.291"));
        logStore.save(repaymentLog);

        repaymentLog.put(entry("card-1", 4, "634.56391"));
        repaymentLog.put(entry("loan-2", 1, "900"));
        logStore.save(repaymentLog);

        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM stored_documents", Integer.class);
        assertEquals(1, rows);
        assertEquals(4, logStore.appliedCount("card-1"));
        assertEquals(2, logStore.load().size());
    }

    @Test
    @DisplayName("Wrongly shaped row loads as an empty log")
    void corruptRow() {
        jdbcTemplate.update(
            "INSERT INTO stored_documents (storage_key, payload, updated_at) VALUES (?, ?::jsonb, now())",
            RepaymentLogStore.DEFAULT_STORAGE_KEY, "{\"entries\": \"oops\"}");

        assertEquals(0, logStore.load().size());
    }

    @Test
    @DisplayName("Clear removes the stored row")
    void clear() {
        RepaymentLog repaymentLog = RepaymentLog.empty(Instant.now());
        repaymentLog.put(entry("card-1", 3, "727.291"));
        logStore.save(repaymentLog);

        logStore.clear();

        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM stored_documents", Integer.class);
        assertEquals(0, rows);
    }
}
