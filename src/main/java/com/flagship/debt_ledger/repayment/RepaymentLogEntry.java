package com.flagship.debt_ledger.repayment;

import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Synchronization state of one debt position.
 *
 * Only the repayment engine writes these. A manual balance correction goes
 * through {@link com.flagship.debt_ledger.sync.RepaymentSyncService#resetCachedBalance}
 * and keeps {@code appliedCount} intact.
 */
@Value
public class RepaymentLogEntry {
    String positionId;
    /** Repayments applied so far, never decreases */
    int appliedCount;
    /** Balance after the applied repayments */
    @With
    BigDecimal cachedBalance;
    BigDecimal cumulativeInterest;
    BigDecimal cumulativePrincipal;
    @With
    Instant lastSyncedAt;
}
