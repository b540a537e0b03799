package com.flagship.wager_escrow.wager;

public enum EvidenceType {
    SCREENSHOT,
    VIDEO,
    MATCH_LINK,
    OTHER
}
