package com.tradejournal.domain.vo;

import java.util.Comparator;

/**
 * Identity of one matching group: all executions of a symbol within one brokerage account.
 * Trades never span two keys. A null account groups orders imported without an account.
 */
public record PositionKey(String accountId, String symbol) implements Comparable<PositionKey> {

    private static final Comparator<PositionKey> ORDER = Comparator.comparing(
                    PositionKey::accountId, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(PositionKey::symbol, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    @Override
    public int compareTo(PositionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return (accountId != null ? accountId : "-") + "/" + symbol;
    }
}
