package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_ledger.balance.DebtSummary;
import com.flagship.debt_ledger.schedule.LoanProgress;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Display summary of one debt position.
 */
@Value
@Builder
public class DebtSummaryResponse {

    @JsonProperty("position_id")
    String positionId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("monthly_repayment")
    BigDecimal monthlyRepayment;

    @JsonProperty("annual_rate_percent")
    BigDecimal annualRatePercent;

    @JsonProperty("paid_off_percent")
    double paidOffPercent;

    @JsonProperty("total_repaid")
    BigDecimal totalRepaid;

    @JsonProperty("months_to_payoff")
    Integer monthsToPayoff;

    @JsonProperty("estimated_payoff_date")
    LocalDate estimatedPayoffDate;

    @JsonProperty("paid_off")
    boolean paidOff;

    @JsonProperty("loan_progress")
    LoanProgressResponse loanProgress;

    public static DebtSummaryResponse from(String positionId, DebtSummary summary) {
        return DebtSummaryResponse.builder()
            .positionId(positionId)
            .balance(Money.display(summary.getBalance()))
            .monthlyRepayment(Money.display(summary.getMonthlyRepayment()))
            .annualRatePercent(summary.getAnnualRatePercent())
            .paidOffPercent(summary.getPaidOffPercent())
            .totalRepaid(Money.display(summary.getTotalRepaid()))
            .monthsToPayoff(summary.getMonthsToPayoff())
            .estimatedPayoffDate(summary.getEstimatedPayoffDate())
            .paidOff(summary.isPaidOff())
            .loanProgress(LoanProgressResponse.from(summary.getLoanProgress()))
            .build();
    }

    @Value
    @Builder
    public static class LoanProgressResponse {

        @JsonProperty("total_months")
        int totalMonths;

        @JsonProperty("months_elapsed")
        int monthsElapsed;

        @JsonProperty("months_remaining")
        int monthsRemaining;

        @JsonProperty("progress_percent")
        double progressPercent;

        @JsonProperty("term_complete")
        boolean termComplete;

        static LoanProgressResponse from(LoanProgress progress) {
            if (progress == null) {
                return null;
            }
            return LoanProgressResponse.builder()
                .totalMonths(progress.getTotalMonths())
                .monthsElapsed(progress.getMonthsElapsed())
                .monthsRemaining(progress.getMonthsRemaining())
                .progressPercent(progress.getProgressPercent())
                .termComplete(progress.isTermComplete())
                .build();
        }
    }
}
