package com.tradejournal.domain.enums;

/**
 * Rule used to decide whether a closed trade is INTRADAY.
 *
 * <p>SAME_CALENDAR_DAY = entry and exit fall on the same exchange-local date.
 * ELAPSED_HOURS = exit is no more than {@code intradayMaxHours} after entry.
 */
public enum HoldingPeriodPolicy {
    SAME_CALENDAR_DAY,
    ELAPSED_HOURS
}
