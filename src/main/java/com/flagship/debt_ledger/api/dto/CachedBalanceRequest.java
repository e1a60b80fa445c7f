package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Manually corrected outstanding balance.
 */
@Value
public class CachedBalanceRequest {

    @NotNull(message = "Balance is required")
    @DecimalMin(value = "0", message = "Balance must not be negative")
    @JsonProperty("balance")
    BigDecimal balance;

    @JsonCreator
    public CachedBalanceRequest(@JsonProperty("balance") BigDecimal balance) {
        this.balance = balance;
    }
}
