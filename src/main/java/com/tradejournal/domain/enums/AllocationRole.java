package com.tradejournal.domain.enums;

/** Whether an order's attributed quantity opened (or added to) a trade, or closed part of it. */
public enum AllocationRole {
    OPENING,
    CLOSING
}
