package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record Subscription(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("currencyCode") String currencyCode,
        @JsonProperty("cycle") BillingCycle cycle,
        @JsonProperty("customCycleDays") int customCycleDays, // only for CUSTOM
        @JsonProperty("nextBillingDate") LocalDate nextBillingDate,
        @JsonProperty("shared") boolean shared,
        @JsonProperty("active") boolean active,
        @JsonProperty("subscriberIds") List<String> subscriberIds, // may include the viewer
        @JsonProperty("deleted") boolean deleted
) {
    public Subscription {
        subscriberIds = subscriberIds == null ? List.of() : List.copyOf(subscriberIds);
    }
}
