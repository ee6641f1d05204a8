package com.swisscoin.ledger.core.money;

import java.math.BigDecimal;

public record CurrencyAmount(String code, BigDecimal amount) {
}
