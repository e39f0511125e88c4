package com.tradejournal.repository.jpa;

import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.entity.TradeEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the trades table.
 * Trades are replaced per (account, symbol) group or wiped per user; there are no updates.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findByUserIdOrderByEntryAtAscIdAsc(String userId);

    List<TradeEntity> findByUserIdAndStatusOrderByEntryAtAscIdAsc(String userId, TradeStatus status);

    @Query("SELECT t FROM TradeEntity t WHERE t.userId = :userId AND t.symbol = :symbol"
            + " AND ((:accountId IS NULL AND t.accountId IS NULL) OR t.accountId = :accountId)"
            + " AND t.status = :status ORDER BY t.entryAt ASC")
    List<TradeEntity> findGroupTradesByStatus(
            @Param("userId") String userId,
            @Param("accountId") String accountId,
            @Param("symbol") String symbol,
            @Param("status") TradeStatus status);

    @Query("SELECT t.id FROM TradeEntity t WHERE t.userId = :userId AND t.symbol = :symbol"
            + " AND ((:accountId IS NULL AND t.accountId IS NULL) OR t.accountId = :accountId)")
    List<String> findGroupTradeIds(
            @Param("userId") String userId, @Param("accountId") String accountId, @Param("symbol") String symbol);

    @Modifying
    @Transactional
    @Query("DELETE FROM TradeEntity t WHERE t.id IN :ids")
    int deleteByIds(@Param("ids") Collection<String> ids);

    @Modifying
    @Transactional
    @Query("DELETE FROM TradeEntity t WHERE t.userId = :userId")
    int deleteByUser(@Param("userId") String userId);
}
