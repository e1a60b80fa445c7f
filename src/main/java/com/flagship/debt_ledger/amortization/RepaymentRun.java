package com.flagship.debt_ledger.amortization;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of applying a run of consecutive monthly repayments.
 *
 * {@code updatesPerformed} can be lower than the number requested when the
 * debt was cleared part-way through the run.
 */
@Value
public class RepaymentRun {
    BigDecimal finalBalance;
    BigDecimal interestCharged;
    BigDecimal principalPaid;
    int updatesPerformed;
    boolean paidOff;
}
