package com.tradingcore.journal;

public enum JournalEntryType {
    ORDER,
    RISK_DECISION
}
