package com.tradejournal.persistence;

import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.vo.PositionKey;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/** Read side of the orders table as seen by trade rebuilds. */
public interface OrderStore {

    /** Orders not yet attributed to any trade. */
    List<Order> fetchUnconsumedOrders(String userId);

    List<Order> fetchAllOrders(String userId);

    /** Every order of one (account, symbol) group, consumed or not. */
    List<Order> fetchGroupOrders(String userId, PositionKey positionKey);

    List<Order> fetchOrdersByIds(String userId, Collection<String> orderIds);

    /** Latest execution time among the group's consumed orders, or null if none is consumed. */
    LocalDateTime findLatestConsumedExecution(String userId, PositionKey positionKey);

    List<String> findUsersWithUnconsumedOrders();
}
