package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record PayerContribution(
        @JsonProperty("participantId") String participantId,
        @JsonProperty("amount") BigDecimal amount
) {
}
