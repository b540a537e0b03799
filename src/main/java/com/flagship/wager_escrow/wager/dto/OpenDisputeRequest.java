package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * The minimum reason length is configuration, so it is enforced by the state
 * machine rather than here.
 */
@Value
public class OpenDisputeRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
