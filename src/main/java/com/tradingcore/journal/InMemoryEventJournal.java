package com.tradingcore.journal;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-durable journal, used when {@code tradingcore.journal.type=memory} and in tests.
 */
public class InMemoryEventJournal implements EventJournal {

    private final List<JournalEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(JournalEntry entry) {
        entry.setSequence(entries.size() + 1L);
        entries.add(entry);
    }

    @Override
    public synchronized List<JournalEntry> readAll() {
        return List.copyOf(entries);
    }
}
