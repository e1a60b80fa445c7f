package com.flagship.debt_ledger.api.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding applied to amounts on their way out of the API.
 * The engine itself never rounds.
 */
final class Money {

    private static final int DISPLAY_SCALE = 2;

    private Money() {
    }

    static BigDecimal display(BigDecimal amount) {
        return amount == null ? null : amount.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);
    }
}
