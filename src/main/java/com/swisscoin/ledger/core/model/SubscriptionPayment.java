package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record SubscriptionPayment(
        @JsonProperty("id") String id,
        @JsonProperty("subscriptionId") String subscriptionId,
        @JsonProperty("payerId") String payerId,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("ts") long ts,
        @JsonProperty("note") String note
) {
}
