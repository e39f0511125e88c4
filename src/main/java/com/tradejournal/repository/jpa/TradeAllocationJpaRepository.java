package com.tradejournal.repository.jpa;

import com.tradejournal.entity.TradeAllocationEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the trade_allocations table (1 trade → N allocations).
 * Allocations are written and deleted together with their trade.
 */
@Repository
public interface TradeAllocationJpaRepository extends JpaRepository<TradeAllocationEntity, String> {

    List<TradeAllocationEntity> findByTradeIdInOrderByTradeIdAscSequenceAsc(Collection<String> tradeIds);

    @Modifying
    @Transactional
    @Query("DELETE FROM TradeAllocationEntity a WHERE a.tradeId IN :tradeIds")
    int deleteByTradeIds(@Param("tradeIds") Collection<String> tradeIds);

    @Modifying
    @Transactional
    @Query("DELETE FROM TradeAllocationEntity a WHERE a.userId = :userId")
    int deleteByUser(@Param("userId") String userId);
}
