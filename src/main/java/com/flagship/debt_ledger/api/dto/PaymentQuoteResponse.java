package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Fixed monthly payment for a loan, with the totals it implies.
 */
@Value
@Builder
public class PaymentQuoteResponse {

    @JsonProperty("principal")
    BigDecimal principal;

    @JsonProperty("annual_rate_percent")
    BigDecimal annualRatePercent;

    @JsonProperty("total_months")
    int totalMonths;

    @JsonProperty("monthly_payment")
    BigDecimal monthlyPayment;

    @JsonProperty("total_repaid")
    BigDecimal totalRepaid;

    @JsonProperty("total_interest")
    BigDecimal totalInterest;

    public static PaymentQuoteResponse of(BigDecimal principal, BigDecimal annualRatePercent,
                                          int totalMonths, BigDecimal monthlyPayment) {
        BigDecimal totalRepaid = monthlyPayment.multiply(BigDecimal.valueOf(totalMonths));
        BigDecimal totalInterest = totalMonths > 0 ? totalRepaid.subtract(principal).max(BigDecimal.ZERO) : BigDecimal.ZERO;
        return PaymentQuoteResponse.builder()
            .principal(principal)
            .annualRatePercent(annualRatePercent)
            .totalMonths(totalMonths)
            .monthlyPayment(Money.display(monthlyPayment))
            .totalRepaid(Money.display(totalRepaid))
            .totalInterest(Money.display(totalInterest))
            .build();
    }
}
