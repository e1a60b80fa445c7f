package com.flagship.debt_ledger.debt;

import lombok.Value;

/**
 * A debt configuration paired with the stable id of the position it belongs to.
 */
@Value(staticConstructor = "of")
public class DebtPosition {
    String positionId;
    DebtConfiguration configuration;
}
