package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_ledger.amortization.RepaymentStep;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Projected month-by-month repayment schedule.
 */
@Value
@Builder
public class ScheduleResponse {

    /** Null when the repayment never clears the debt within the cap */
    @JsonProperty("months_to_payoff")
    Integer monthsToPayoff;

    @JsonProperty("total_interest")
    BigDecimal totalInterest;

    @JsonProperty("steps")
    List<StepResponse> steps;

    public static ScheduleResponse from(List<RepaymentStep> schedule) {
        boolean converges = !schedule.isEmpty() && schedule.get(schedule.size() - 1).isPaidOff();
        BigDecimal totalInterest = schedule.isEmpty()
            ? BigDecimal.ZERO
            : schedule.get(schedule.size() - 1).getCumulativeInterest();

        return ScheduleResponse.builder()
            .monthsToPayoff(converges ? schedule.size() : null)
            .totalInterest(Money.display(totalInterest))
            .steps(schedule.stream().map(StepResponse::from).collect(Collectors.toList()))
            .build();
    }

    @Value
    @Builder
    public static class StepResponse {

        @JsonProperty("month")
        int month;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("interest")
        BigDecimal interest;

        @JsonProperty("principal")
        BigDecimal principal;

        @JsonProperty("cumulative_interest")
        BigDecimal cumulativeInterest;

        @JsonProperty("cumulative_principal")
        BigDecimal cumulativePrincipal;

        @JsonProperty("paid_off")
        boolean paidOff;

        static StepResponse from(RepaymentStep step) {
            return StepResponse.builder()
                .month(step.getMonth())
                .balance(Money.display(step.getBalance()))
                .interest(Money.display(step.getInterest()))
                .principal(Money.display(step.getPrincipal()))
                .cumulativeInterest(Money.display(step.getCumulativeInterest()))
                .cumulativePrincipal(Money.display(step.getCumulativePrincipal()))
                .paidOff(step.isPaidOff())
                .build();
        }
    }
}
