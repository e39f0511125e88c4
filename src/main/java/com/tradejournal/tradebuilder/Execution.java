package com.tradejournal.tradebuilder;

import com.tradejournal.domain.model.Order;
import java.math.BigDecimal;

/**
 * Quantity of one order fed to the matcher. Usually the whole order; when an open trade is
 * resumed, only the part previously allocated to that trade.
 */
public record Execution(Order order, BigDecimal quantity) {

    public static Execution of(Order order) {
        return new Execution(order, order.getQuantity());
    }
}
