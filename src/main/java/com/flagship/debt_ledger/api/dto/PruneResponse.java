package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class PruneResponse {

    @JsonProperty("pruned")
    int pruned;
}
