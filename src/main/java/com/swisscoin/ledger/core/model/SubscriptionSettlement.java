package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record SubscriptionSettlement(
        @JsonProperty("id") String id,
        @JsonProperty("subscriptionId") String subscriptionId,
        @JsonProperty("fromParticipantId") String fromParticipantId,
        @JsonProperty("toParticipantId") String toParticipantId,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("ts") long ts,
        @JsonProperty("note") String note
) {
}
