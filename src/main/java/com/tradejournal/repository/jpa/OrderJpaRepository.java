package com.tradejournal.repository.jpa;

import com.tradejournal.entity.OrderEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the orders table.
 * Reads executions for trade rebuilds and writes the used_in_trade / trade_id tags.
 * Group queries treat a null account as its own group.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByUserId(String userId);

    List<OrderEntity> findByUserIdAndUsedInTradeFalse(String userId);

    List<OrderEntity> findByUserIdAndIdIn(String userId, Collection<String> ids);

    @Query("SELECT o FROM OrderEntity o WHERE o.userId = :userId AND o.symbol = :symbol"
            + " AND ((:accountId IS NULL AND o.accountId IS NULL) OR o.accountId = :accountId)")
    List<OrderEntity> findGroupOrders(
            @Param("userId") String userId, @Param("accountId") String accountId, @Param("symbol") String symbol);

    @Query("SELECT MAX(o.executedAt) FROM OrderEntity o WHERE o.userId = :userId AND o.symbol = :symbol"
            + " AND ((:accountId IS NULL AND o.accountId IS NULL) OR o.accountId = :accountId)"
            + " AND o.usedInTrade = true")
    LocalDateTime findLatestConsumedExecution(
            @Param("userId") String userId, @Param("accountId") String accountId, @Param("symbol") String symbol);

    @Query("SELECT DISTINCT o.userId FROM OrderEntity o WHERE o.usedInTrade = false ORDER BY o.userId")
    List<String> findUsersWithUnconsumedOrders();

    @Modifying
    @Transactional
    @Query("UPDATE OrderEntity o SET o.usedInTrade = true, o.tradeId = :tradeId"
            + " WHERE o.userId = :userId AND o.id IN :orderIds")
    int tagOrders(
            @Param("userId") String userId,
            @Param("tradeId") String tradeId,
            @Param("orderIds") Collection<String> orderIds);

    @Modifying
    @Transactional
    @Query("UPDATE OrderEntity o SET o.usedInTrade = false, o.tradeId = null"
            + " WHERE o.userId = :userId AND o.tradeId IN :tradeIds")
    int clearTagsForTrades(@Param("userId") String userId, @Param("tradeIds") Collection<String> tradeIds);

    @Modifying
    @Transactional
    @Query("UPDATE OrderEntity o SET o.usedInTrade = false, o.tradeId = null WHERE o.userId = :userId")
    int clearTagsForUser(@Param("userId") String userId);
}
