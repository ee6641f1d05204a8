package com.swisscoin.ledger;

import com.swisscoin.ledger.core.config.ConfigService;
import com.swisscoin.ledger.core.config.ViewerSession;
import com.swisscoin.ledger.core.ledger.LedgerService;
import com.swisscoin.ledger.core.model.HomeSummary;
import com.swisscoin.ledger.core.money.CurrencyAmount;
import com.swisscoin.ledger.core.money.MoneyFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;

/**
 * Headless entry point: restores the saved viewer and logs their home summary.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(SpringConfig.class)
                .web(WebApplicationType.NONE)
                .run(args)) {
            ViewerSession session = context.getBean(ViewerSession.class);
            if (!context.getBean(ConfigService.class).tryRestore(session)) {
                log.info("no saved viewer profile, nothing to show");
                return;
            }
            HomeSummary summary = context.getBean(LedgerService.class).homeSummary(session.viewerId);
            log.info("{} - you owe: {}", session.displayName, describe(summary.youOweSorted()));
            log.info("{} - owed to you: {}", session.displayName, describe(summary.owedToYouSorted()));
        }
    }

    private static String describe(List<CurrencyAmount> amounts) {
        if (amounts.isEmpty()) return "nothing";
        StringBuilder sb = new StringBuilder();
        for (CurrencyAmount a : amounts) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(MoneyFormatter.format(a.amount(), a.code()));
        }
        return sb.toString();
    }
}
