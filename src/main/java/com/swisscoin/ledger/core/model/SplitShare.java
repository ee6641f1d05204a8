package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record SplitShare(
        @JsonProperty("participantId") String participantId,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("rawInput") BigDecimal rawInput // pct, share count, exact amount or adjustment; null for EQUAL
) {
}
