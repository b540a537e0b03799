package com.flagship.wager_escrow.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wager_escrow.wager.UserWagerStats;
import lombok.Value;

import java.util.UUID;

@Value
public class UserWagerStatsResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("created_count")
    long createdCount;

    @JsonProperty("accepted_count")
    long acceptedCount;

    @JsonProperty("won_count")
    long wonCount;

    @JsonProperty("lost_count")
    long lostCount;

    @JsonProperty("win_rate")
    double winRate;

    @JsonProperty("total_earnings")
    long totalEarnings;

    @JsonProperty("total_wagered")
    long totalWagered;

    public static UserWagerStatsResponse from(UserWagerStats stats) {
        return new UserWagerStatsResponse(stats.getUserId(), stats.getCreated(), stats.getAccepted(),
                stats.getWon(), stats.getLost(), stats.getWinRate(),
                stats.getTotalEarnings(), stats.getTotalWagered());
    }
}
