package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_escrow.wager.EvidenceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class SubmitProofRequest {

    @NotNull(message = "Claimed winner is required")
    @JsonProperty("claimed_winner_id")
    UUID claimedWinnerId;

    @NotBlank(message = "Evidence URL is required")
    @JsonProperty("evidence_url")
    String evidenceUrl;

    @NotNull(message = "Evidence type is required")
    @JsonProperty("evidence_type")
    EvidenceType evidenceType;
}
