package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Participant(
        @JsonProperty("id") String id,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("deleted") boolean deleted
) {
    public String safeName() {
        return displayName == null || displayName.isBlank() ? "Unknown" : displayName;
    }
}
