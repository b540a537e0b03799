package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * An absent moderator id means "next one from the pool".
 */
@Value
public class AssignModeratorRequest {

    @JsonProperty("moderator_id")
    UUID moderatorId;
}
