package com.tradejournal.fixtures;

import com.tradejournal.domain.enums.AssetClass;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.enums.OrderStatus;
import com.tradejournal.domain.model.Order;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/** Order builders shared by trade construction and rebuild tests. Defaults: user-1, ACC-1, AAPL. */
public final class OrderFixtures {

    public static final String USER = "user-1";
    public static final String ACCOUNT = "ACC-1";
    public static final String SYMBOL = "AAPL";

    private OrderFixtures() {}

    /** 2024-03-04 (a Monday) at the given exchange-local time. */
    public static LocalDateTime at(int hour, int minute) {
        return LocalDateTime.of(2024, 3, 4, hour, minute);
    }

    public static Order buy(String id, String quantity, String price, LocalDateTime executedAt) {
        return order(id, OrderSide.BUY, quantity, price, executedAt);
    }

    public static Order sell(String id, String quantity, String price, LocalDateTime executedAt) {
        return order(id, OrderSide.SELL, quantity, price, executedAt);
    }

    public static Order order(String id, OrderSide side, String quantity, String price, LocalDateTime executedAt) {
        return Order.builder()
                .id(id)
                .userId(USER)
                .accountId(ACCOUNT)
                .symbol(SYMBOL)
                .assetClass(AssetClass.EQUITY)
                .side(side)
                .status(OrderStatus.FILLED)
                .quantity(new BigDecimal(quantity))
                .price(new BigDecimal(price))
                .commission(BigDecimal.ZERO)
                .fees(BigDecimal.ZERO)
                .executedAt(executedAt)
                .build();
    }

    public static Order withCosts(Order order, String commission, String fees) {
        return order.toBuilder()
                .commission(new BigDecimal(commission))
                .fees(new BigDecimal(fees))
                .build();
    }

    public static Order inSymbol(Order order, String symbol) {
        return order.toBuilder().symbol(symbol).build();
    }
}
