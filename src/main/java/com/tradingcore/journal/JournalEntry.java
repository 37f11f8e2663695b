package com.tradingcore.journal;

import com.tradingcore.domain.model.Order;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One journal line. Exactly one of {@code order} and {@code decision} is set, matching
 * {@code type}. {@code sequence} is assigned by the journal on append.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalEntry {

    private long sequence;
    private Instant recordedAt;
    private JournalEntryType type;

    /** Order event type or decision outcome, for readability of the file. */
    private String eventType;

    private String detail;
    private Order order;
    private RiskDecisionRecord decision;
}
