package com.swisscoin.ledger.core.model;

import com.swisscoin.ledger.core.money.CurrencyAmount;
import com.swisscoin.ledger.core.money.CurrencyBalance;

import java.util.List;

public record HomeSummary(CurrencyBalance youOwe, CurrencyBalance owedToYou) {

    public List<CurrencyAmount> youOweSorted() {
        return youOwe.sortedCurrencies();
    }

    public List<CurrencyAmount> owedToYouSorted() {
        return owedToYou.sortedCurrencies();
    }
}
