package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Body of {@code POST /api/wagers}. Stake bounds are checked by the state
 * machine against the configured limits.
 */
@Value
public class CreateWagerRequest {

    @NotNull(message = "Stake amount is required")
    @JsonProperty("stake_amount")
    Long stakeAmount;

    @NotBlank(message = "Game is required")
    @Size(max = 100, message = "Game must be at most 100 characters")
    @JsonProperty("game")
    String game;

    @JsonProperty("target_user_id")
    UUID targetUserId;

    @Size(max = 200, message = "Title must be at most 200 characters")
    @JsonProperty("title")
    String title;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    @JsonProperty("description")
    String description;
}
