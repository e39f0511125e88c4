package com.tradejournal.domain.enums;

/** Buy or sell side of a brokerage execution. */
public enum OrderSide {
    BUY,
    SELL;

    /** Direction a position takes when this side opens it: BUY -> LONG, SELL -> SHORT. */
    public TradeSide openingDirection() {
        return this == BUY ? TradeSide.LONG : TradeSide.SHORT;
    }
}
