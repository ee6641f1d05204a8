package com.swisscoin.ledger.core.split;

import com.swisscoin.ledger.core.model.SplitMethod;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unvalidated input of the "new transaction" form.
 *
 * @param paidBy payer id to amount, in display order; the amount may be {@code null} when only
 *               one person paid. Empty means the viewer paid everything.
 */
public record TransactionDraft(
        String title,
        BigDecimal totalAmount,
        String currencyCode,
        long ts,
        SplitMethod splitMethod,
        List<String> participantIds,
        Map<String, BigDecimal> rawInputs,
        Map<String, BigDecimal> paidBy,
        String groupId,
        String note
) {
    public TransactionDraft {
        participantIds = participantIds == null ? List.of() : List.copyOf(participantIds);
        rawInputs = rawInputs == null ? Map.of() : withoutBlanks(rawInputs);
        paidBy = paidBy == null ? new LinkedHashMap<>() : new LinkedHashMap<>(paidBy);
    }

    // une saisie vide compte comme absente
    private static Map<String, BigDecimal> withoutBlanks(Map<String, BigDecimal> inputs) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        inputs.forEach((id, value) -> {
            if (value != null) out.put(id, value);
        });
        return Collections.unmodifiableMap(out);
    }

    public static TransactionDraft equalSplit(String title, BigDecimal total, String currencyCode, List<String> participantIds) {
        return new TransactionDraft(title, total, currencyCode, System.currentTimeMillis(), SplitMethod.EQUAL,
                participantIds, Map.of(), Map.of(), null, null);
    }
}
