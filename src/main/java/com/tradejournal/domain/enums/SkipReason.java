package com.tradejournal.domain.enums;

/** Why the sequencer excluded an order from matching. */
public enum SkipReason {
    MISSING_EXECUTION_TIME,
    NON_POSITIVE_QUANTITY,
    MISSING_PRICE,
    NOT_EXECUTED,
    INCOMPLETE_ORDER,
    DUPLICATE_ORDER
}
