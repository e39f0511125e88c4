package com.tradejournal.domain.enums;

/**
 * How much history a rebuild recomputes.
 *
 * <p>INCREMENTAL consumes only untagged orders and resumes each group's open trade.
 * FULL clears every trade and tag for the user and reprocesses all orders.
 * GROUP is used internally when an incremental run finds late-arriving history for a single
 * (account, symbol) group and rebuilds that group from all of its orders.
 */
public enum RebuildScope {
    INCREMENTAL,
    FULL,
    GROUP
}
