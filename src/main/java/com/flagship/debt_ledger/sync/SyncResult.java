package com.flagship.debt_ledger.sync;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of syncing one debt position.
 */
@Value
public class SyncResult {
    String positionId;
    BigDecimal currentBalance;
    /** Repayments applied by this sync call, 0 when already up to date */
    int newRepaymentsApplied;
    int totalRepaymentsApplied;
    BigDecimal cumulativeInterest;
    BigDecimal cumulativePrincipal;
    boolean paidOff;
}
