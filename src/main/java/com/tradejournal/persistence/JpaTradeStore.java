package com.tradejournal.persistence;

import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.domain.vo.PositionKey;
import com.tradejournal.entity.TradeAllocationEntity;
import com.tradejournal.entity.TradeEntity;
import com.tradejournal.exception.AtomicityFailureException;
import com.tradejournal.exception.BusinessException;
import com.tradejournal.exception.ErrorCode;
import com.tradejournal.exception.ReconciliationRequiredException;
import com.tradejournal.mapper.TradeMapper;
import com.tradejournal.repository.jpa.OrderJpaRepository;
import com.tradejournal.repository.jpa.TradeAllocationJpaRepository;
import com.tradejournal.repository.jpa.TradeJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Trade persistence over H2 / JPA.
 *
 * <p>{@link #replaceGroup(GroupCommit)} runs delete-trades, insert-trades and tag-orders in one
 * transaction and flushes before returning, so constraint violations surface here as
 * {@link AtomicityFailureException} rather than at commit time. A tag update that touches fewer
 * rows than expected also fails the commit: an order vanished or belongs to another user.
 */
@Component
public class JpaTradeStore implements TradeStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTradeStore.class);

    private final TradeJpaRepository tradeJpaRepository;
    private final TradeAllocationJpaRepository tradeAllocationJpaRepository;
    private final OrderJpaRepository orderJpaRepository;
    private final TradeMapper tradeMapper;

    public JpaTradeStore(
            TradeJpaRepository tradeJpaRepository,
            TradeAllocationJpaRepository tradeAllocationJpaRepository,
            OrderJpaRepository orderJpaRepository,
            TradeMapper tradeMapper) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.tradeAllocationJpaRepository = tradeAllocationJpaRepository;
        this.orderJpaRepository = orderJpaRepository;
        this.tradeMapper = tradeMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Trade> findOpenTrade(String userId, PositionKey positionKey) {
        List<TradeEntity> open = tradeJpaRepository.findGroupTradesByStatus(
                userId, positionKey.accountId(), positionKey.symbol(), TradeStatus.OPEN);
        if (open.isEmpty()) {
            return Optional.empty();
        }
        if (open.size() > 1) {
            throw new ReconciliationRequiredException(
                    positionKey, null, "Group " + positionKey + " has " + open.size() + " open trades");
        }
        return Optional.of(withAllocations(open).get(0));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findTrades(String userId, TradeStatus status) {
        List<TradeEntity> entities = status == null
                ? tradeJpaRepository.findByUserIdOrderByEntryAtAscIdAsc(userId)
                : tradeJpaRepository.findByUserIdAndStatusOrderByEntryAtAscIdAsc(userId, status);
        return withAllocations(entities);
    }

    @Override
    @Transactional
    public void deleteAllForUser(String userId) {
        try {
            int allocations = tradeAllocationJpaRepository.deleteByUser(userId);
            int trades = tradeJpaRepository.deleteByUser(userId);
            int orders = orderJpaRepository.clearTagsForUser(userId);
            log.info(
                    "Cleared trades for full rebuild: userId={}, trades={}, allocations={}, ordersUntagged={}",
                    userId,
                    trades,
                    allocations,
                    orders);
        } catch (DataAccessException e) {
            throw new BusinessException(
                    ErrorCode.INTERNAL_ERROR, "Failed to clear trades for user " + userId, e);
        }
    }

    @Override
    @Transactional
    public void replaceGroup(GroupCommit commit) {
        String userId = commit.getUserId();
        PositionKey key = commit.getPositionKey();
        try {
            List<String> replaced = commit.isReplaceWholeGroup()
                    ? tradeJpaRepository.findGroupTradeIds(userId, key.accountId(), key.symbol())
                    : commit.getReplacedTradeIds();
            if (!replaced.isEmpty()) {
                orderJpaRepository.clearTagsForTrades(userId, replaced);
                tradeAllocationJpaRepository.deleteByTradeIds(replaced);
                tradeJpaRepository.deleteByIds(replaced);
            }

            LocalDateTime now = LocalDateTime.now();
            List<TradeEntity> tradeEntities = new ArrayList<>();
            List<TradeAllocationEntity> allocationEntities = new ArrayList<>();
            for (Trade trade : commit.getTrades()) {
                TradeEntity entity = tradeMapper.toEntity(trade);
                entity.setCreatedAt(now);
                tradeEntities.add(entity);
                allocationEntities.addAll(tradeMapper.toAllocationEntities(trade));
            }
            tradeJpaRepository.saveAll(tradeEntities);
            tradeAllocationJpaRepository.saveAll(allocationEntities);
            tradeJpaRepository.flush();

            Map<String, List<String>> ordersByTrade = commit.getOrderTags().entrySet().stream()
                    .collect(Collectors.groupingBy(
                            Map.Entry::getValue,
                            LinkedHashMap::new,
                            Collectors.mapping(Map.Entry::getKey, Collectors.toList())));
            for (Map.Entry<String, List<String>> entry : ordersByTrade.entrySet()) {
                int tagged = orderJpaRepository.tagOrders(userId, entry.getKey(), entry.getValue());
                if (tagged != entry.getValue().size()) {
                    throw new AtomicityFailureException(String.format(
                            "Tagged %d of %d orders for trade %s in %s",
                            tagged, entry.getValue().size(), entry.getKey(), key));
                }
            }

            log.debug(
                    "Group committed: userId={}, key={}, removed={}, inserted={}, tagged={}",
                    userId,
                    key,
                    replaced.size(),
                    tradeEntities.size(),
                    commit.getOrderTags().size());
        } catch (DataAccessException e) {
            throw new AtomicityFailureException("Failed to commit trades for " + key, e);
        }
    }

    private List<Trade> withAllocations(List<TradeEntity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        Map<String, List<TradeAllocationEntity>> allocationsByTrade = tradeAllocationJpaRepository
                .findByTradeIdInOrderByTradeIdAscSequenceAsc(
                        entities.stream().map(TradeEntity::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(TradeAllocationEntity::getTradeId));
        return entities.stream()
                .map(e -> tradeMapper.toDomain(e, allocationsByTrade.getOrDefault(e.getId(), List.of())))
                .toList();
    }
}
