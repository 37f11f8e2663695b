package com.tradingcore.risk;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of {@link EmergencyHaltService#activate(String)}.
 *
 * <p>{@code firstActivation} is false for repeated or concurrent calls, which only notify; their
 * counts are zero.
 */
@Data
@Builder
public class HaltResult {

    private boolean firstActivation;

    private String reason;

    private Instant activatedAt;

    private int ordersCancelled;

    private int cancelsFailed;

    private boolean liquidationRequested;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean isClean() {
        return errors.isEmpty();
    }
}
