package com.tradejournal.persistence;

import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.vo.PositionKey;
import com.tradejournal.mapper.OrderMapper;
import com.tradejournal.repository.jpa.OrderJpaRepository;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class JpaOrderStore implements OrderStore {

    private final OrderJpaRepository orderJpaRepository;
    private final OrderMapper orderMapper;

    public JpaOrderStore(OrderJpaRepository orderJpaRepository, OrderMapper orderMapper) {
        this.orderJpaRepository = orderJpaRepository;
        this.orderMapper = orderMapper;
    }

    @Override
    public List<Order> fetchUnconsumedOrders(String userId) {
        return orderMapper.toDomainList(orderJpaRepository.findByUserIdAndUsedInTradeFalse(userId));
    }

    @Override
    public List<Order> fetchAllOrders(String userId) {
        return orderMapper.toDomainList(orderJpaRepository.findByUserId(userId));
    }

    @Override
    public List<Order> fetchGroupOrders(String userId, PositionKey positionKey) {
        return orderMapper.toDomainList(
                orderJpaRepository.findGroupOrders(userId, positionKey.accountId(), positionKey.symbol()));
    }

    @Override
    public List<Order> fetchOrdersByIds(String userId, Collection<String> orderIds) {
        if (orderIds.isEmpty()) {
            return List.of();
        }
        return orderMapper.toDomainList(orderJpaRepository.findByUserIdAndIdIn(userId, orderIds));
    }

    @Override
    public LocalDateTime findLatestConsumedExecution(String userId, PositionKey positionKey) {
        return orderJpaRepository.findLatestConsumedExecution(
                userId, positionKey.accountId(), positionKey.symbol());
    }

    @Override
    public List<String> findUsersWithUnconsumedOrders() {
        return orderJpaRepository.findUsersWithUnconsumedOrders();
    }
}
