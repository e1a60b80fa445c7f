package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_ledger.sync.SyncResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SyncResponse {

    @JsonProperty("position_id")
    String positionId;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("new_repayments_applied")
    int newRepaymentsApplied;

    @JsonProperty("total_repayments_applied")
    int totalRepaymentsApplied;

    @JsonProperty("cumulative_interest")
    BigDecimal cumulativeInterest;

    @JsonProperty("cumulative_principal")
    BigDecimal cumulativePrincipal;

    @JsonProperty("paid_off")
    boolean paidOff;

    public static SyncResponse from(SyncResult result) {
        return SyncResponse.builder()
            .positionId(result.getPositionId())
            .currentBalance(Money.display(result.getCurrentBalance()))
            .newRepaymentsApplied(result.getNewRepaymentsApplied())
            .totalRepaymentsApplied(result.getTotalRepaymentsApplied())
            .cumulativeInterest(Money.display(result.getCumulativeInterest()))
            .cumulativePrincipal(Money.display(result.getCumulativePrincipal()))
            .paidOff(result.isPaidOff())
            .build();
    }
}
