package com.tradingcore.journal;

import java.util.List;

/**
 * Append-only record of order state changes and risk decisions, read back on startup.
 */
public interface EventJournal {

    /**
     * Appends the entry and assigns its sequence number.
     *
     * @throws com.tradingcore.exception.JournalException if the entry could not be stored
     */
    void append(JournalEntry entry);

    /** All entries in append order. */
    List<JournalEntry> readAll();
}
