package com.flagship.debt_ledger.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Debt parameters supplied by the portfolio layer.
 *
 * Read-only input to the engine. The portfolio layer owns and validates it:
 * APR >= 0, repayment day in [1, 31], entry timestamp not in the future.
 */
@Value
@Builder(toBuilder = true)
public class DebtConfiguration {
    /** Outstanding balance when the debt was entered */
    BigDecimal entryBalance;
    /** APR as a percentage, 0 for interest-free */
    BigDecimal annualRatePercent;
    BigDecimal monthlyRepayment;
    int repaymentDayOfMonth;
    Instant enteredAt;

    LocalDate loanStartDate;
    LocalDate loanEndDate;

    boolean paidOff;
    boolean archived;

    /**
     * True when both loan term dates are known.
     */
    public boolean hasLoanTerm() {
        return loanStartDate != null && loanEndDate != null;
    }

    /**
     * Archived and paid-off debts no longer accrue repayments.
     */
    public boolean isAccruing() {
        return !archived && !paidOff;
    }
}
