package com.tradejournal.domain.enums;

/** Holding-period bucket of a trade, derived from its entry and exit times. */
public enum HoldingPeriodClass {
    INTRADAY,
    MULTIDAY
}
