package com.flagship.debt_ledger.schedule;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

/**
 * Calendar arithmetic for monthly repayment events.
 *
 * A repayment day beyond the length of a month (31 in April, 30 in
 * February) falls on that month's last day.
 */
@Component
public class RepaymentDueCounter {

    /**
     * Whole calendar months from {@code from} to {@code to}, ignoring days.
     *
     * @return (toYear - fromYear) * 12 + (toMonth - fromMonth), never negative
     */
    public int monthsBetween(LocalDate from, LocalDate to) {
        int months = (to.getYear() - from.getYear()) * 12 + (to.getMonthValue() - from.getMonthValue());
        return Math.max(0, months);
    }

    /**
     * Number of days in a month, leap years included.
     *
     * @param year Full year, e.g. 2025
     * @param month Month of year, 1 (January) to 12 (December)
     */
    public int daysInMonth(int year, int month) {
        return YearMonth.of(year, month).lengthOfMonth();
    }

    /**
     * The day a repayment actually falls on in the given month.
     */
    public int effectiveRepaymentDay(YearMonth month, int repaymentDayOfMonth) {
        return Math.min(repaymentDayOfMonth, month.lengthOfMonth());
    }

    /**
     * Counts the repayment events that have occurred from the entry date up
     * to and including {@code today}.
     *
     * The entry month holds the first event when the entry day is on or
     * before that month's repayment day, so a debt entered on its repayment
     * day is due that same day. Otherwise the first event is in the next
     * month. Today's month counts only once today has reached its repayment day.
     *
     * @param entryDate Date the debt was entered
     * @param repaymentDayOfMonth Repayment day, 1 to 31
     * @param today Current date
     * @return Number of repayments due, zero when today precedes the first event
     */
    public int repaymentsDue(LocalDate entryDate, int repaymentDayOfMonth, LocalDate today) {
        YearMonth firstEvent = YearMonth.from(entryDate);
        if (entryDate.getDayOfMonth() > effectiveRepaymentDay(firstEvent, repaymentDayOfMonth)) {
            firstEvent = firstEvent.plusMonths(1);
        }

        YearMonth currentMonth = YearMonth.from(today);
        if (firstEvent.isAfter(currentMonth)) {
            return 0;
        }

        // Every month strictly before the current one has fully elapsed
        int count = (int) firstEvent.until(currentMonth, ChronoUnit.MONTHS);
        if (today.getDayOfMonth() >= effectiveRepaymentDay(currentMonth, repaymentDayOfMonth)) {
            count++;
        }
        return count;
    }
}
