package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_ledger.debt.DebtConfiguration;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Debt parameters of one position, as sent by the portfolio layer.
 */
@Value
public class DebtConfigurationRequest {

    @NotNull(message = "Entry balance is required")
    @DecimalMin(value = "0", message = "Entry balance must not be negative")
    @JsonProperty("entry_balance")
    BigDecimal entryBalance;

    @NotNull(message = "APR is required")
    @DecimalMin(value = "0", message = "APR must not be negative")
    @JsonProperty("annual_rate_percent")
    BigDecimal annualRatePercent;

    @NotNull(message = "Monthly repayment is required")
    @DecimalMin(value = "0", message = "Monthly repayment must not be negative")
    @JsonProperty("monthly_repayment")
    BigDecimal monthlyRepayment;

    @Min(value = 1, message = "Repayment day must be between 1 and 31")
    @Max(value = 31, message = "Repayment day must be between 1 and 31")
    @JsonProperty("repayment_day_of_month")
    int repaymentDayOfMonth;

    @NotNull(message = "Entry timestamp is required")
    @PastOrPresent(message = "Entry timestamp must not be in the future")
    @JsonProperty("entered_at")
    Instant enteredAt;

    @JsonProperty("loan_start_date")
    LocalDate loanStartDate;

    @JsonProperty("loan_end_date")
    LocalDate loanEndDate;

    @JsonProperty("paid_off")
    boolean paidOff;

    @JsonProperty("archived")
    boolean archived;

    public DebtConfiguration toConfiguration() {
        return DebtConfiguration.builder()
            .entryBalance(entryBalance)
            .annualRatePercent(annualRatePercent)
            .monthlyRepayment(monthlyRepayment)
            .repaymentDayOfMonth(repaymentDayOfMonth)
            .enteredAt(enteredAt)
            .loanStartDate(loanStartDate)
            .loanEndDate(loanEndDate)
            .paidOff(paidOff)
            .archived(archived)
            .build();
    }
}
