package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.Set;

@Value
public class PruneRequest {

    @NotNull(message = "Active position IDs are required")
    @JsonProperty("active_position_ids")
    Set<String> activePositionIds;

    @JsonCreator
    public PruneRequest(@JsonProperty("active_position_ids") Set<String> activePositionIds) {
        this.activePositionIds = activePositionIds;
    }
}
