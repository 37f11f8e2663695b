package com.tradingcore.oms;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one {@link ReconciliationService#sweep()}.
 */
@Data
@Builder
public class ReconciliationReport {

    private Instant startedAt;

    /** False when the broker could not be queried; nothing else was compared. */
    private boolean brokerQueried;

    private int brokerOpenOrders;

    private int localOpenOrders;

    /** Timed-out placements matched to a broker order. */
    private int brokerIdsAttached;

    /** Fills the broker reports that had not reached the order book. */
    private int missedFillsApplied;

    /** Unconfirmed placements with no broker counterpart, now REJECTED. */
    private int placementsRejected;

    /** Locally terminal orders still working at the broker, cancel re-sent. */
    private int cancelsResent;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
