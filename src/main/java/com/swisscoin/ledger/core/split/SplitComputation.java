package com.swisscoin.ledger.core.split;

import com.swisscoin.ledger.core.model.SplitShare;

import java.math.BigDecimal;
import java.util.List;

public record SplitComputation(List<SplitShare> shares, List<SplitWarning> warnings) {

    public SplitComputation {
        shares = List.copyOf(shares);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public BigDecimal total() {
        return shares.stream().map(SplitShare::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal amountFor(String participantId) {
        return shares.stream()
                .filter(s -> s.participantId().equals(participantId))
                .map(SplitShare::amount)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
