package com.tradingcore.core.engine;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Symbol to strategy-id subscription table used for tick routing.
 *
 * <p>Read on every tick, written only when strategies are added or removed, hence
 * {@link CopyOnWriteArrayList} values: iteration needs no locking and sees a consistent snapshot.
 * Strategy ids are stored rather than strategy objects; the dispatcher resolves them.
 */
@Component
public class SymbolSubscriptionRouter {

    private static final Logger log = LoggerFactory.getLogger(SymbolSubscriptionRouter.class);

    private final Map<String, CopyOnWriteArrayList<String>> subscriptions = new ConcurrentHashMap<>();

    /** Returns false if the strategy was already subscribed to the symbol. */
    public boolean subscribe(String symbol, String strategyId) {
        boolean added = subscriptions
                .computeIfAbsent(symbol, k -> new CopyOnWriteArrayList<>())
                .addIfAbsent(strategyId);
        log.debug("Strategy {} subscribed to {} (new={})", strategyId, symbol, added);
        return added;
    }

    public void unsubscribe(String symbol, String strategyId) {
        subscriptions.computeIfPresent(symbol, (s, strategies) -> {
            strategies.remove(strategyId);
            // Drop empty lists so retired symbols do not accumulate
            return strategies.isEmpty() ? null : strategies;
        });
        log.debug("Strategy {} unsubscribed from {}", strategyId, symbol);
    }

    /**
     * Strategy ids subscribed to the symbol, in subscription order. Never null.
     */
    public List<String> getSubscribedStrategies(String symbol) {
        CopyOnWriteArrayList<String> strategies = subscriptions.get(symbol);
        return strategies != null ? strategies : List.of();
    }

    public Set<String> getSubscribedSymbols() {
        return Set.copyOf(subscriptions.keySet());
    }

    public int getSubscriptionCount() {
        return subscriptions.values().stream().mapToInt(List::size).sum();
    }
}
