package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UserGroup(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("memberIds") List<String> memberIds,
        @JsonProperty("deleted") boolean deleted
) {
    public UserGroup {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }
}
