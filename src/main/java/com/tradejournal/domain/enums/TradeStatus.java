package com.tradejournal.domain.enums;

public enum TradeStatus {
    OPEN,
    CLOSED
}
