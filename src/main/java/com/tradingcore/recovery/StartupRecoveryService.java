package com.tradingcore.recovery;

import com.tradingcore.domain.model.Order;
import com.tradingcore.exception.JournalException;
import com.tradingcore.journal.EventJournal;
import com.tradingcore.journal.JournalEntry;
import com.tradingcore.journal.JournalEntryType;
import com.tradingcore.oms.OrderLifecycleManager;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the order book from the event journal on startup.
 *
 * <p>For each order id the entry with the highest {@code version} wins, so the result does not
 * depend on the order in which entries were written. Positions are not rebuilt; the broker
 * reconciliation sweep picks up any working order whose state moved on while the process was
 * down.
 */
@Component
@org.springframework.core.annotation.Order(0)
public class StartupRecoveryService implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final EventJournal eventJournal;
    private final OrderLifecycleManager orderLifecycleManager;
    private final boolean enabled;

    public StartupRecoveryService(
            EventJournal eventJournal,
            OrderLifecycleManager orderLifecycleManager,
            @Value("${tradingcore.journal.recover-on-startup:true}") boolean enabled) {
        this.eventJournal = eventJournal;
        this.orderLifecycleManager = orderLifecycleManager;
        this.enabled = enabled;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!enabled) {
            log.info("Order recovery disabled");
            return;
        }
        recover();
    }

    /**
     * Restores the newest journaled state of every order.
     *
     * @return number of orders restored
     */
    public int recover() {
        List<JournalEntry> entries;
        try {
            entries = eventJournal.readAll();
        } catch (JournalException e) {
            log.error("Order recovery failed, starting with an empty order book: {}", e.getMessage(), e);
            return 0;
        }

        Collection<Order> latest = latestVersions(entries);
        if (latest.isEmpty()) {
            log.info("No journaled orders to recover");
            return 0;
        }
        orderLifecycleManager.restore(latest);
        long open = latest.stream().filter(Order::isOpen).count();
        log.info("Recovered {} orders from {} journal entries, {} still open", latest.size(), entries.size(), open);
        return latest.size();
    }

    static Collection<Order> latestVersions(List<JournalEntry> entries) {
        Map<String, Order> latest = new LinkedHashMap<>();
        for (JournalEntry entry : entries) {
            if (entry.getType() != JournalEntryType.ORDER || entry.getOrder() == null) {
                continue;
            }
            Order order = entry.getOrder();
            latest.merge(order.getId(), order, (current, candidate) ->
                    candidate.getVersion() >= current.getVersion() ? candidate : current);
        }
        return latest.values();
    }
}
