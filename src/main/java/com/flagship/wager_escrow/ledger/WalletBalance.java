package com.flagship.wager_escrow.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class WalletBalance {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("available")
    long available;

    @JsonProperty("escrow")
    long escrow;
}
