package com.tradejournal.rebuild;

import com.tradejournal.config.RebuildConfig;
import com.tradejournal.domain.enums.ProblemType;
import com.tradejournal.domain.enums.RebuildScope;
import com.tradejournal.domain.enums.SkipReason;
import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.domain.model.MultiUserRebuildResult;
import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.model.OrderAllocation;
import com.tradejournal.domain.model.RebuildProblem;
import com.tradejournal.domain.model.RebuildResult;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.domain.vo.PositionKey;
import com.tradejournal.event.TradesRebuiltEvent;
import com.tradejournal.exception.AtomicityFailureException;
import com.tradejournal.exception.BusinessException;
import com.tradejournal.exception.RebuildInProgressException;
import com.tradejournal.exception.ReconciliationRequiredException;
import com.tradejournal.persistence.GroupCommit;
import com.tradejournal.persistence.OrderStore;
import com.tradejournal.persistence.TradeStore;
import com.tradejournal.tradebuilder.GroupConstruction;
import com.tradejournal.tradebuilder.OrderSequencer;
import com.tradejournal.tradebuilder.SequencedOrders;
import com.tradejournal.tradebuilder.TradeConstructionService;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Orchestrates trade rebuilds for a user.
 *
 * <p>Two scopes:
 * <ul>
 *   <li><b>INCREMENTAL:</b> only unconsumed orders are processed. Each affected group resumes
 *       from its persisted OPEN trade, which is replaced by the freshly constructed trade(s);
 *       closed trades are never touched. When new orders predate the group's latest consumed
 *       execution, the group is rebuilt from all of its orders instead (group-scoped rebuild)
 *       so the outcome matches a full rebuild.</li>
 *   <li><b>FULL:</b> all of the user's trades and order tags are cleared in one transaction,
 *       then every order is reprocessed.</li>
 * </ul>
 *
 * <p>Groups are independent and are constructed and committed in parallel on
 * {@code groupRebuildExecutor}; the call returns once every group has finished. Each group
 * commits atomically, and a failing group is reported as a problem while the others complete.
 * Only whole-call failures are thrown: invalid user id, rebuild already running for the user,
 * or the full-rebuild reset failing.
 */
@Service
public class TradeRebuildService {

    private static final Logger log = LoggerFactory.getLogger(TradeRebuildService.class);

    private final OrderStore orderStore;
    private final TradeStore tradeStore;
    private final TradeConstructionService tradeConstructionService;
    private final RebuildLockService rebuildLockService;
    private final RebuildConfig rebuildConfig;
    private final Executor groupRebuildExecutor;
    private final Executor userRebuildExecutor;
    private final ApplicationEventPublisher applicationEventPublisher;

    public TradeRebuildService(
            OrderStore orderStore,
            TradeStore tradeStore,
            TradeConstructionService tradeConstructionService,
            RebuildLockService rebuildLockService,
            RebuildConfig rebuildConfig,
            @Qualifier("groupRebuildExecutor") Executor groupRebuildExecutor,
            @Qualifier("userRebuildExecutor") Executor userRebuildExecutor,
            ApplicationEventPublisher applicationEventPublisher) {
        this.orderStore = orderStore;
        this.tradeStore = tradeStore;
        this.tradeConstructionService = tradeConstructionService;
        this.rebuildLockService = rebuildLockService;
        this.rebuildConfig = rebuildConfig;
        this.groupRebuildExecutor = groupRebuildExecutor;
        this.userRebuildExecutor = userRebuildExecutor;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /** Incremental rebuild: attributes the user's unconsumed orders. */
    public RebuildResult processUserOrders(String userId) {
        return rebuild(userId, RebuildScope.INCREMENTAL);
    }

    /** Full rebuild: discards and reconstructs every trade of the user. */
    public RebuildResult rebuildAllTrades(String userId) {
        return rebuild(userId, RebuildScope.FULL);
    }

    /**
     * Runs one user's rebuild under the per-user lock.
     *
     * @throws BusinessException          if the user id is blank or the scope is not INCREMENTAL / FULL
     * @throws RebuildInProgressException if a rebuild for the same user is already running
     */
    public RebuildResult rebuild(String userId, RebuildScope scope) {
        if (userId == null || userId.isBlank()) {
            throw new BusinessException("userId is required");
        }
        if (scope != RebuildScope.INCREMENTAL && scope != RebuildScope.FULL) {
            throw new BusinessException("Unsupported rebuild scope: " + scope);
        }
        if (!rebuildLockService.tryLock(userId)) {
            throw new RebuildInProgressException(userId);
        }

        RebuildResult result;
        try {
            result = doRebuild(userId, scope);
        } finally {
            rebuildLockService.unlock(userId);
        }

        applicationEventPublisher.publishEvent(new TradesRebuiltEvent(this, result));
        return result;
    }

    /** Incremental rebuild for each user, {@code batchSize} users at a time. */
    public MultiUserRebuildResult processUsers(Collection<String> userIds) {
        return newMultiUserJob(userIds, RebuildScope.INCREMENTAL).run();
    }

    /** Creates a cancellable multi-user job; the caller decides on which thread to run it. */
    public MultiUserRebuildJob newMultiUserJob(Collection<String> userIds, RebuildScope scope) {
        List<String> distinctUsers = new ArrayList<>(new LinkedHashSet<>(userIds));
        return new MultiUserRebuildJob(
                UUID.randomUUID().toString(),
                distinctUsers,
                scope,
                rebuildConfig.getBatchSize(),
                this,
                userRebuildExecutor);
    }

    public List<Trade> findTrades(String userId, TradeStatus status) {
        if (userId == null || userId.isBlank()) {
            throw new BusinessException("userId is required");
        }
        return tradeStore.findTrades(userId, status);
    }

    private RebuildResult doRebuild(String userId, RebuildScope scope) {
        LocalDateTime startedAt = LocalDateTime.now();
        long start = System.currentTimeMillis();
        log.info("Rebuild started: userId={}, scope={}", userId, scope);

        List<Order> orders;
        if (scope == RebuildScope.FULL) {
            tradeStore.deleteAllForUser(userId);
            orders = orderStore.fetchAllOrders(userId);
        } else {
            orders = orderStore.fetchUnconsumedOrders(userId);
        }

        SequencedOrders sequenced = tradeConstructionService.sequence(orders);

        List<CompletableFuture<GroupOutcome>> futures = new ArrayList<>();
        for (Map.Entry<PositionKey, List<Order>> group : sequenced.getGroups().entrySet()) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> processGroup(userId, scope, group.getKey(), group.getValue()), groupRebuildExecutor));
        }
        List<GroupOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

        List<Trade> trades = new ArrayList<>();
        List<RebuildProblem> problems = new ArrayList<>(sequenced.getSkipped());
        int groupsRebuilt = 0;
        for (GroupOutcome outcome : outcomes) {
            trades.addAll(outcome.trades());
            problems.addAll(outcome.problems());
            if (outcome.groupRebuilt()) {
                groupsRebuilt++;
            }
        }

        RebuildResult result = RebuildResult.builder()
                .userId(userId)
                .scope(scope)
                .startedAt(startedAt)
                .durationMs(System.currentTimeMillis() - start)
                .ordersConsidered(orders.size())
                .groupsProcessed(outcomes.size())
                .groupsRebuilt(groupsRebuilt)
                .trades(trades)
                .problems(problems)
                .build();

        log.info(
                "Rebuild complete: userId={}, scope={}, orders={}, groups={}, trades={}, problems={}, durationMs={}",
                userId,
                scope,
                result.getOrdersConsidered(),
                result.getGroupsProcessed(),
                result.getTradeCount(),
                problems.size(),
                result.getDurationMs());
        return result;
    }

    /** Constructs and commits one group. Never throws: failures become problems. */
    private GroupOutcome processGroup(String userId, RebuildScope scope, PositionKey key, List<Order> newOrders) {
        try {
            if (scope == RebuildScope.FULL) {
                GroupConstruction construction =
                        tradeConstructionService.constructGroup(userId, key, null, Map.of(), newOrders);
                commit(userId, key, construction, List.of(), false);
                return new GroupOutcome(construction.getTrades(), List.of(), false);
            }
            return processIncrementalGroup(userId, key, newOrders);
        } catch (ReconciliationRequiredException e) {
            log.warn("Group needs reconciliation: userId={}, key={}, reason={}", userId, key, e.getMessage());
            return GroupOutcome.failed(TradeConstructionService.groupProblem(
                    ProblemType.RECONCILIATION_REQUIRED, key, e.getOrderId(), e.getMessage()));
        } catch (AtomicityFailureException e) {
            log.error("Group commit failed, rolled back: userId={}, key={}", userId, key, e);
            return GroupOutcome.failed(TradeConstructionService.groupProblem(
                    ProblemType.ATOMICITY_FAILURE, key, null, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Group rebuild failed: userId={}, key={}", userId, key, e);
            return GroupOutcome.failed(TradeConstructionService.groupProblem(
                    ProblemType.GROUP_FAILURE, key, null, e.getMessage()));
        }
    }

    private GroupOutcome processIncrementalGroup(String userId, PositionKey key, List<Order> newOrders) {
        LocalDateTime latestConsumed = orderStore.findLatestConsumedExecution(userId, key);
        if (latestConsumed != null && newOrders.get(0).getExecutedAt().isBefore(latestConsumed)) {
            return rebuildGroup(userId, key, latestConsumed);
        }

        List<Order> groupHistory = List.of();
        List<RebuildProblem> problems = new ArrayList<>();
        List<Order> orders = newOrders;
        if (latestConsumed != null && newOrders.stream().anyMatch(o -> o.getBrokerOrderId() != null)) {
            groupHistory = orderStore.fetchGroupOrders(userId, key);
            orders = dropReimportedOrders(newOrders, groupHistory, problems);
            if (orders.isEmpty()) {
                return new GroupOutcome(List.of(), problems, false);
            }
        }

        Trade openTrade = tradeStore.findOpenTrade(userId, key).orElse(null);
        Map<String, Order> resumeOrders = Map.of();
        if (openTrade != null) {
            Set<String> ids = openTrade.getAllocations().stream()
                    .map(OrderAllocation::getOrderId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            List<Order> source = groupHistory.isEmpty() ? orderStore.fetchOrdersByIds(userId, ids) : groupHistory;
            resumeOrders = source.stream()
                    .filter(o -> ids.contains(o.getId()))
                    .collect(Collectors.toMap(Order::getId, Function.identity()));
        }

        GroupConstruction construction =
                tradeConstructionService.constructGroup(userId, key, openTrade, resumeOrders, orders);
        commit(userId, key, construction, openTrade != null ? List.of(openTrade.getId()) : List.of(), false);
        return new GroupOutcome(construction.getTrades(), problems, false);
    }

    /** Late history: rebuild the group from all of its orders and replace all of its trades. */
    private GroupOutcome rebuildGroup(String userId, PositionKey key, LocalDateTime latestConsumed) {
        log.info("Late orders found, rebuilding group: userId={}, key={}, latestConsumed={}", userId, key, latestConsumed);
        SequencedOrders groupOrders = tradeConstructionService.sequence(orderStore.fetchGroupOrders(userId, key));
        // orders skipped here are unconsumed and were already reported by the user-level sequencing
        List<Order> orders = groupOrders.getGroups().getOrDefault(key, List.of());
        GroupConstruction construction = tradeConstructionService.constructGroup(userId, key, null, Map.of(), orders);
        commit(userId, key, construction, List.of(), true);
        return new GroupOutcome(construction.getTrades(), List.of(), true);
    }

    /**
     * New orders whose broker execution id is already consumed in the group are re-imports of
     * fills the group has seen. A full rebuild would drop them as duplicates; so does this.
     */
    private List<Order> dropReimportedOrders(
            List<Order> newOrders, List<Order> groupHistory, List<RebuildProblem> problems) {
        Set<String> consumedBrokerIds = new HashSet<>();
        for (Order order : groupHistory) {
            if (order.isUsedInTrade() && order.getBrokerOrderId() != null) {
                consumedBrokerIds.add(order.getBrokerOrderId());
            }
        }
        List<Order> kept = new ArrayList<>(newOrders.size());
        for (Order order : newOrders) {
            if (order.getBrokerOrderId() != null && consumedBrokerIds.contains(order.getBrokerOrderId())) {
                log.warn(
                        "Order skipped: orderId={}, symbol={}, accountId={}, reason={}",
                        order.getId(),
                        order.getSymbol(),
                        order.getAccountId(),
                        SkipReason.DUPLICATE_ORDER);
                problems.add(OrderSequencer.skippedOrder(order, SkipReason.DUPLICATE_ORDER));
            } else {
                kept.add(order);
            }
        }
        return kept;
    }

    private void commit(
            String userId,
            PositionKey key,
            GroupConstruction construction,
            List<String> replacedTradeIds,
            boolean replaceWholeGroup) {
        tradeStore.replaceGroup(GroupCommit.builder()
                .userId(userId)
                .positionKey(key)
                .replacedTradeIds(replacedTradeIds)
                .replaceWholeGroup(replaceWholeGroup)
                .trades(construction.getTrades())
                .orderTags(construction.getOrderTags())
                .build());
    }

    private record GroupOutcome(List<Trade> trades, List<RebuildProblem> problems, boolean groupRebuilt) {

        static GroupOutcome failed(RebuildProblem problem) {
            return new GroupOutcome(List.of(), List.of(problem), false);
        }
    }
}
