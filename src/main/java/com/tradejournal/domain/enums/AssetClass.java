package com.tradejournal.domain.enums;

public enum AssetClass {
    EQUITY,
    OPTION,
    OTHER
}
