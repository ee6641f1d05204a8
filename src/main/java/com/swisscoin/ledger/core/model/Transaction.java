package com.swisscoin.ledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record Transaction(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("totalAmount") BigDecimal totalAmount,
        @JsonProperty("currencyCode") String currencyCode,
        @JsonProperty("ts") long ts,
        @JsonProperty("splitMethod") SplitMethod splitMethod,
        @JsonProperty("payerId") String payerId, // legacy single payer
        @JsonProperty("payers") List<PayerContribution> payers,
        @JsonProperty("splits") List<SplitShare> splits,
        @JsonProperty("groupId") String groupId,
        @JsonProperty("note") String note,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("deleted") boolean deleted
) {
    public Transaction {
        payers = payers == null ? List.of() : List.copyOf(payers);
        splits = splits == null ? List.of() : List.copyOf(splits);
    }

    /**
     * Payer rows, or a single contribution of the full total by the legacy payer when the
     * record predates multi-payer support.
     */
    public List<PayerContribution> effectivePayers() {
        if (!payers.isEmpty()) return payers;
        if (payerId == null) return List.of();
        return List.of(new PayerContribution(payerId, totalAmount));
    }

    public boolean involves(String participantId) {
        if (participantId == null) return false;
        for (PayerContribution p : effectivePayers()) {
            if (participantId.equals(p.participantId())) return true;
        }
        for (SplitShare s : splits) {
            if (participantId.equals(s.participantId())) return true;
        }
        return false;
    }

    public Transaction withAmounts(BigDecimal newTotal, List<PayerContribution> newPayers, List<SplitShare> newSplits) {
        return new Transaction(id, title, newTotal, currencyCode, ts, splitMethod, payerId,
                newPayers, newSplits, groupId, note, createdBy, deleted);
    }
}
