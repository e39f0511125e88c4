package com.tradejournal.domain.enums;

/** Exchange session in which a trade was entered. */
public enum MarketSession {
    PRE_MARKET,
    REGULAR,
    AFTER_HOURS
}
