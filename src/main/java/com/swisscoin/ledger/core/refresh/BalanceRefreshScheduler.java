package com.swisscoin.ledger.core.refresh;

import com.swisscoin.ledger.core.config.ViewerSession;
import com.swisscoin.ledger.core.ledger.LedgerChangedEvent;
import com.swisscoin.ledger.core.ledger.LedgerService;
import com.swisscoin.ledger.core.model.HomeSummary;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Recomputes the viewer's home summary in the background after ledger writes. Requests arriving
 * within the debounce window collapse into one computation.
 */
@Service
public class BalanceRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(BalanceRefreshScheduler.class);

    private final LedgerService ledger;
    private final ViewerSession session;
    private final long debounceMs;
    private ScheduledExecutorService ses;
    private ScheduledFuture<?> pending;
    private volatile Consumer<HomeSummary> listener = summary -> {
    };

    public BalanceRefreshScheduler(LedgerService ledger, ViewerSession session,
                                   @Value("${app.balance.debounce-ms:500}") long debounceMs) {
        this.ledger = ledger;
        this.session = session;
        this.debounceMs = debounceMs;
    }

    public void setListener(Consumer<HomeSummary> listener) {
        this.listener = listener;
    }

    @EventListener
    public void onLedgerChanged(LedgerChangedEvent event) {
        log.debug("ledger changed ({}), refresh requested", event.what());
        requestRefresh();
    }

    public synchronized void requestRefresh() {
        if (ses == null) {
            ses = Executors.newSingleThreadScheduledExecutor(r -> {
                var t = new Thread(r, "balance-refresh");
                t.setDaemon(true);
                return t;
            });
        }
        // la dernière demande gagne
        if (pending != null) pending.cancel(false);
        pending = ses.schedule(this::refresh, debounceMs, TimeUnit.MILLISECONDS);
    }

    private void refresh() {
        String viewerId = session.viewerId;
        if (viewerId == null) return;
        try {
            HomeSummary summary = ledger.homeSummary(viewerId);
            listener.accept(summary);
        } catch (RuntimeException e) {
            log.warn("balance refresh failed", e);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (ses != null) {
            ses.shutdownNow();
            ses = null;
            pending = null;
        }
    }
}
