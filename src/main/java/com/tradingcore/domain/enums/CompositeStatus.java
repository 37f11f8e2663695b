package com.tradingcore.domain.enums;

/**
 * Progress of a composite (BRACKET/COVER) order as seen from its entry leg.
 */
public enum CompositeStatus {
    /** Not a composite entry. */
    NONE,
    /** Entry working, protective legs not yet created (BRACKET only). */
    AWAITING_ENTRY,
    /** Protective legs live. */
    PROTECTED,
    /** One protective leg filled and its sibling was cancelled. */
    RESOLVED,
    /** Entry cancelled or rejected with nothing left to protect. */
    ABANDONED
}
