package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_ledger.repayment.RepaymentLogEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class RepaymentLogEntryResponse {

    @JsonProperty("position_id")
    String positionId;

    @JsonProperty("applied_count")
    int appliedCount;

    @JsonProperty("cached_balance")
    BigDecimal cachedBalance;

    @JsonProperty("cumulative_interest")
    BigDecimal cumulativeInterest;

    @JsonProperty("cumulative_principal")
    BigDecimal cumulativePrincipal;

    @JsonProperty("last_synced_at")
    Instant lastSyncedAt;

    public static RepaymentLogEntryResponse from(RepaymentLogEntry entry) {
        return RepaymentLogEntryResponse.builder()
            .positionId(entry.getPositionId())
            .appliedCount(entry.getAppliedCount())
            .cachedBalance(Money.display(entry.getCachedBalance()))
            .cumulativeInterest(Money.display(entry.getCumulativeInterest()))
            .cumulativePrincipal(Money.display(entry.getCumulativePrincipal()))
            .lastSyncedAt(entry.getLastSyncedAt())
            .build();
    }
}
