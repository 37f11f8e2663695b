package com.tradingcore.domain.enums;

/**
 * Order kinds understood by the lifecycle manager.
 *
 * <p>MARKET, LIMIT and STOP are plain single-leg orders. BRACKET and COVER are composite:
 * <ul>
 *   <li><b>BRACKET:</b> a LIMIT entry whose take-profit and stop-loss children are created
 *       only once the entry fills. The two children are one-cancels-other.</li>
 *   <li><b>COVER:</b> an entry plus a protective STOP child created together.</li>
 * </ul>
 */
public enum OrderKind {
    MARKET,
    LIMIT,
    STOP,
    BRACKET,
    COVER;

    public boolean isComposite() {
        return this == BRACKET || this == COVER;
    }
}
