package com.flagship.wager_escrow.wager;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Input of {@link WagerStateMachine#create}. {@code targetUserId}, {@code title},
 * {@code description} and {@code idempotencyKey} are optional.
 */
@Value
@Builder
public class NewWager {
    UUID creatorId;
    long stakeAmount;
    String game;
    UUID targetUserId;
    String title;
    String description;
    String idempotencyKey;
}
