package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_escrow.wager.Dispute;
import com.flagship.wager_escrow.wager.DisputeResolution;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DisputeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("wager_id")
    UUID wagerId;

    @JsonProperty("disputer_id")
    UUID disputerId;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("assigned_moderator_id")
    UUID assignedModeratorId;

    @JsonProperty("assigned_at")
    Instant assignedAt;

    @JsonProperty("resolution")
    DisputeResolution resolution;

    @JsonProperty("resolved_by")
    UUID resolvedBy;

    @JsonProperty("moderator_notes")
    String moderatorNotes;

    @JsonProperty("opened_at")
    Instant openedAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    public static DisputeResponse from(Dispute dispute) {
        return DisputeResponse.builder()
            .id(dispute.getId())
            .wagerId(dispute.getWagerId())
            .disputerId(dispute.getDisputerId())
            .reason(dispute.getReason())
            .assignedModeratorId(dispute.getAssignedModeratorId())
            .assignedAt(dispute.getAssignedAt())
            .resolution(dispute.getResolution())
            .resolvedBy(dispute.getResolvedBy())
            .moderatorNotes(dispute.getModeratorNotes())
            .openedAt(dispute.getOpenedAt())
            .resolvedAt(dispute.getResolvedAt())
            .build();
    }
}
