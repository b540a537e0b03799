package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_escrow.wager.DisputeResolution;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ResolveDisputeRequest {

    @NotNull(message = "Resolution is required")
    @JsonProperty("resolution")
    DisputeResolution resolution;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    @JsonProperty("notes")
    String notes;
}
