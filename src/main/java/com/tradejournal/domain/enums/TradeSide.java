package com.tradejournal.domain.enums;

/**
 * Direction of a reconstructed trade, taken from its opening leg.
 * LONG positions are opened by BUY executions and closed by SELL executions; SHORT the reverse.
 */
public enum TradeSide {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Multiplies (exit - entry) into signed P&L. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    public TradeSide opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
