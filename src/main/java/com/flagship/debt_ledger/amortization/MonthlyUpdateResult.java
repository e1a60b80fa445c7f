package com.flagship.debt_ledger.amortization;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of applying one month of interest and one repayment to a balance.
 *
 * Invariants: newBalance >= 0, interestCharged >= 0.
 */
@Value
public class MonthlyUpdateResult {
    BigDecimal newBalance;
    BigDecimal interestCharged;
    BigDecimal principalPaid;
    boolean paidOff;

    /**
     * Result for a balance that is already cleared.
     */
    public static MonthlyUpdateResult alreadyPaidOff() {
        return new MonthlyUpdateResult(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, true);
    }
}
