package com.tradingcore.oms;

import com.tradingcore.core.concurrent.KeyedSerialExecutor;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Serializes order work per symbol. Validation and placement of one intent run as a single task
 * on the symbol's lane, so the next intent for that symbol is validated against an order book
 * that already contains the previous one.
 */
@Component
public class SymbolOrderSequencer {

    private final KeyedSerialExecutor lanes;

    public SymbolOrderSequencer(@Qualifier("orderExecutor") Executor orderExecutor) {
        this.lanes = new KeyedSerialExecutor("symbol", orderExecutor);
    }

    public <T> CompletableFuture<T> submit(String symbol, Supplier<T> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        lanes.execute(symbol, () -> {
            try {
                result.complete(work.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }
}
