package com.flagship.debt_ledger.schedule;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Derives elapsed and remaining months for a fixed-term loan.
 */
@Component
@RequiredArgsConstructor
public class LoanProgressCalculator {

    private final RepaymentDueCounter dueCounter;

    /**
     * @param startDate Loan start date
     * @param endDate Loan end date
     * @param today Current date
     * @return Progress with the percentage clamped to [0, 100]
     */
    public LoanProgress loanProgress(LocalDate startDate, LocalDate endDate, LocalDate today) {
        int totalMonths = dueCounter.monthsBetween(startDate, endDate);
        int monthsElapsed = dueCounter.monthsBetween(startDate, today);
        int monthsRemaining = Math.max(0, totalMonths - monthsElapsed);
        double progressPercent = totalMonths > 0
            ? Math.min(100.0, (double) monthsElapsed / totalMonths * 100.0)
            : 0.0;

        return new LoanProgress(
            totalMonths,
            monthsElapsed,
            monthsRemaining,
            progressPercent,
            monthsElapsed >= totalMonths
        );
    }
}
