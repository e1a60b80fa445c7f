package com.flagship.debt_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_ledger.debt.DebtPosition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class DebtPositionRequest {

    @NotBlank(message = "Position ID is required")
    @JsonProperty("position_id")
    String positionId;

    @NotNull(message = "Configuration is required")
    @Valid
    @JsonProperty("configuration")
    DebtConfigurationRequest configuration;

    public DebtPosition toPosition() {
        return DebtPosition.of(positionId, configuration.toConfiguration());
    }
}
