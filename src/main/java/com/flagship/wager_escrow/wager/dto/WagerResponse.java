package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_escrow.wager.SettlementOutcome;
import com.flagship.wager_escrow.wager.Wager;
import com.flagship.wager_escrow.wager.WagerSnapshot;
import com.flagship.wager_escrow.wager.WagerStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Wager snapshot as returned by every wager endpoint.
 */
@Value
@Builder
public class WagerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("game")
    String game;

    @JsonProperty("creator_id")
    UUID creatorId;

    @JsonProperty("acceptor_id")
    UUID acceptorId;

    @JsonProperty("target_user_id")
    UUID targetUserId;

    @JsonProperty("winner_id")
    UUID winnerId;

    @JsonProperty("stake_amount")
    long stakeAmount;

    @JsonProperty("payout_amount")
    Long payoutAmount;

    @JsonProperty("platform_fee")
    Long platformFee;

    @JsonProperty("settlement_outcome")
    SettlementOutcome settlementOutcome;

    @JsonProperty("state")
    WagerStatus state;

    @JsonProperty("is_expired")
    boolean expired;

    @JsonProperty("can_dispute")
    boolean canDispute;

    @JsonProperty("dispute_deadline")
    Instant disputeDeadline;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("accepted_at")
    Instant acceptedAt;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("result_submitted_at")
    Instant resultSubmittedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("proofs")
    List<ProofResponse> proofs;

    @JsonProperty("dispute")
    DisputeResponse dispute;

    public static WagerResponse from(WagerSnapshot snapshot) {
        Wager wager = snapshot.getWager();
        return WagerResponse.builder()
            .id(wager.getId())
            .title(wager.getTitle())
            .description(wager.getDescription())
            .game(wager.getGame())
            .creatorId(wager.getCreatorId())
            .acceptorId(wager.getAcceptorId())
            .targetUserId(wager.getTargetUserId())
            .winnerId(wager.getWinnerId())
            .stakeAmount(wager.getStakeAmount())
            .payoutAmount(wager.getPayoutAmount())
            .platformFee(wager.getPlatformFee())
            .settlementOutcome(wager.getSettlementOutcome())
            .state(wager.getStatus())
            .expired(snapshot.isExpired())
            .canDispute(snapshot.isCanDispute())
            .disputeDeadline(snapshot.getDisputeDeadline())
            .createdAt(wager.getCreatedAt())
            .expiresAt(wager.getExpiresAt())
            .acceptedAt(wager.getAcceptedAt())
            .startedAt(wager.getStartedAt())
            .resultSubmittedAt(wager.getResultSubmittedAt())
            .completedAt(wager.getCompletedAt())
            .proofs(snapshot.getProofs().stream().map(ProofResponse::from).toList())
            .dispute(snapshot.getDispute() != null ? DisputeResponse.from(snapshot.getDispute()) : null)
            .build();
    }
}
