package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record Settlement(
        @JsonProperty("id") String id,
        @JsonProperty("fromParticipantId") String fromParticipantId,
        @JsonProperty("toParticipantId") String toParticipantId,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("currencyCode") String currencyCode,
        @JsonProperty("ts") long ts,
        @JsonProperty("note") String note,
        @JsonProperty("fullSettlement") boolean fullSettlement,
        @JsonProperty("groupId") String groupId, // set when recorded from a group
        @JsonProperty("deleted") boolean deleted
) {
    public boolean isBetween(String a, String b) {
        return (a.equals(fromParticipantId) && b.equals(toParticipantId))
                || (b.equals(fromParticipantId) && a.equals(toParticipantId));
    }
}
