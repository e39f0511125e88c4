package com.tradejournal.domain.enums;

/**
 * Broker-reported lifecycle state of an order as normalized by ingestion.
 *
 * <p>Only FILLED and PARTIALLY_FILLED orders carry an execution and take part in trade
 * construction. A missing status is treated as FILLED because normalized feeds only
 * deliver executions.
 */
public enum OrderStatus {
    PENDING,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isExecuted() {
        return this == FILLED || this == PARTIALLY_FILLED;
    }
}
