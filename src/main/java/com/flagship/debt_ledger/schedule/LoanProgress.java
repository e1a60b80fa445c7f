package com.flagship.debt_ledger.schedule;

import lombok.Value;

/**
 * Progress through a loan with known start and end dates.
 */
@Value
public class LoanProgress {
    int totalMonths;
    int monthsElapsed;
    int monthsRemaining;
    /** 0 to 100 */
    double progressPercent;
    boolean termComplete;
}
