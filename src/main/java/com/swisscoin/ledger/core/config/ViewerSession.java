package com.swisscoin.ledger.core.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Who is looking at the ledger. Engine calls take the viewer id explicitly; this only holds it
 * for the application shell.
 */
@Component
public class ViewerSession {
    public String viewerId;
    public String displayName;
    public String defaultCurrency; // ISO code, ex: CHF

    public ViewerSession(@Value("${app.currency.default:USD}") String defaultCurrency) {
        this.defaultCurrency = defaultCurrency.trim().toUpperCase(Locale.ROOT);
    }

    public String currencyOrDefault(String code) {
        return code == null || code.isBlank() ? defaultCurrency : code.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isSignedIn() {
        return viewerId != null && !viewerId.isBlank();
    }
}
