package com.flagship.debt_ledger.amortization;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One month of a projected repayment schedule.
 */
@Value
public class RepaymentStep {
    /** 1-based month index */
    int month;
    /** Balance at the end of the month */
    BigDecimal balance;
    BigDecimal interest;
    BigDecimal principal;
    BigDecimal cumulativeInterest;
    BigDecimal cumulativePrincipal;
    boolean paidOff;
}
