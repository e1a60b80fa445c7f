package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

/**
 * Every debt position of a portfolio, synced in one pass.
 */
@Value
public class SyncBatchRequest {

    @NotNull(message = "Positions are required")
    @JsonProperty("positions")
    List<@Valid @NotNull DebtPositionRequest> positions;

    @JsonCreator
    public SyncBatchRequest(@JsonProperty("positions") List<DebtPositionRequest> positions) {
        this.positions = positions;
    }
}
