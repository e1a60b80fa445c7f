package com.flagship.debt_ledger.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

class RepaymentDueCounterTest {

    private final RepaymentDueCounter counter = new RepaymentDueCounter();

    @Test
    @DisplayName("Months between ignores the day of month and never goes negative")
    void monthsBetween() {
        assertEquals(0, counter.monthsBetween(LocalDate.of(2025, 1, 31), LocalDate.of(2025, 1, 1)));
        assertEquals(1, counter.monthsBetween(LocalDate.of(2025, 1, 31), LocalDate.of(2025, 2, 1)));
        assertEquals(14, counter.monthsBetween(LocalDate.of(2024, 11, 15), LocalDate.of(2026, 1, 2)));
        assertEquals(0, counter.monthsBetween(LocalDate.of(2025, 6, 1), LocalDate.of(2024, 6, 1)));
    }

    @Test
    @DisplayName("Days in month uses 1-based months and knows leap years")
    void daysInMonth() {
        assertEquals(31, counter.daysInMonth(2025, 1));
        assertEquals(28, counter.daysInMonth(2025, 2));
        assertEquals(29, counter.daysInMonth(2024, 2));
        assertEquals(30, counter.daysInMonth(2025, 4));
        assertEquals(31, counter.daysInMonth(2025, 12));
    }

    @Test
    @DisplayName("Repayment day beyond the month's length clamps to its last day")
    void effectiveRepaymentDay() {
        assertEquals(28, counter.effectiveRepaymentDay(YearMonth.of(2025, 2), 31));
        assertEquals(29, counter.effectiveRepaymentDay(YearMonth.of(2024, 2), 30));
        assertEquals(30, counter.effectiveRepaymentDay(YearMonth.of(2025, 4), 31));
        assertEquals(15, counter.effectiveRepaymentDay(YearMonth.of(2025, 4), 15));
    }

    @ParameterizedTest(name = "entered {0}, day {1}, today {2} -> {3} due")
    @CsvSource({
        // first event in the entry month
        "2025-01-01, 1, 2025-06-02, 6",
        "2025-01-10, 15, 2025-01-14, 0",
        "2025-01-10, 15, 2025-01-15, 1",
        "2025-01-10, 15, 2025-03-20, 3",
        // entered exactly on the repayment day
        "2025-01-15, 15, 2025-01-15, 1",
        "2025-03-15, 15, 2025-04-16, 2",
        // entered after the repayment day, first event next month
        "2025-01-20, 15, 2025-01-31, 0",
        "2025-01-20, 15, 2025-02-14, 0",
        "2025-01-20, 15, 2025-02-15, 1",
        "2025-01-20, 15, 2025-12-15, 11",
        // today before the entry
        "2025-05-01, 1, 2025-04-30, 0"
    })
    void repaymentsDue(LocalDate entryDate, int repaymentDay, LocalDate today, int expected) {
        assertEquals(expected, counter.repaymentsDue(entryDate, repaymentDay, today));
    }

    @Test
    @DisplayName("Day 31 falls on the last day of short months")
    void endOfMonthClamping() {
        LocalDate entered = LocalDate.of(2025, 1, 31);

        assertEquals(1, counter.repaymentsDue(entered, 31, LocalDate.of(2025, 1, 31)));
        assertEquals(1, counter.repaymentsDue(entered, 31, LocalDate.of(2025, 2, 27)));
        assertEquals(2, counter.repaymentsDue(entered, 31, LocalDate.of(2025, 2, 28)));
        assertEquals(3, counter.repaymentsDue(entered, 31, LocalDate.of(2025, 4, 1)));
        assertEquals(4, counter.repaymentsDue(entered, 31, LocalDate.of(2025, 4, 30)));
    }

    @Test
    @DisplayName("Entry on the 30th of January with day 30 skips nothing in February")
    void clampedEntryMonth() {
        LocalDate entered = LocalDate.of(2024, 1, 30);

        assertEquals(2, counter.repaymentsDue(entered, 30, LocalDate.of(2024, 2, 29)));
        assertEquals(1, counter.repaymentsDue(entered, 30, LocalDate.of(2024, 2, 28)));
    }

    @Test
    @DisplayName("Same inputs always give the same count")
    void deterministic() {
        LocalDate entered = LocalDate.of(2023, 7, 9);
        LocalDate today = LocalDate.of(2025, 3, 3);

        int first = counter.repaymentsDue(entered, 12, today);
        int second = counter.repaymentsDue(entered, 12, today);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("One month later the count grows by exactly one")
    void oneMonthLater() {
        LocalDate entered = LocalDate.of(2023, 7, 9);
        for (int day = 1; day <= 28; day++) {
            LocalDate today = LocalDate.of(2025, 3, day);
            int now = counter.repaymentsDue(entered, 12, today);
            int later = counter.repaymentsDue(entered, 12, today.plusMonths(1));
            assertEquals(now + 1, later, "today=" + today);
        }
    }
}
