package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_escrow.wager.EvidenceType;
import com.flagship.wager_escrow.wager.Proof;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ProofResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("submitter_id")
    UUID submitterId;

    @JsonProperty("claimed_winner_id")
    UUID claimedWinnerId;

    @JsonProperty("evidence_url")
    String evidenceUrl;

    @JsonProperty("evidence_type")
    EvidenceType evidenceType;

    @JsonProperty("submitted_at")
    Instant submittedAt;

    public static ProofResponse from(Proof proof) {
        return new ProofResponse(proof.getId(), proof.getSubmitterId(), proof.getClaimedWinnerId(),
                proof.getEvidenceUrl(), proof.getEvidenceType(), proof.getSubmittedAt());
    }
}
