package com.tradejournal.tradebuilder;

import com.tradejournal.domain.enums.ProblemType;
import com.tradejournal.domain.enums.SkipReason;
import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.model.RebuildProblem;
import com.tradejournal.domain.vo.PositionKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates, deduplicates and orders executions for matching.
 *
 * <p>Orders are grouped by (accountId, symbol) and sorted by execution time, then ingestion
 * sequence, then id. The last two keys make the order total even when a broker reports several
 * fills with the same timestamp; which fill lands in which trade depends on this order.
 *
 * <p>Excluded orders are reported as SKIPPED_ORDER problems and never abort the run:
 * <ul>
 *   <li>no execution time, non-positive quantity, missing or negative price</li>
 *   <li>status other than FILLED / PARTIALLY_FILLED</li>
 *   <li>missing symbol or side</li>
 *   <li>repeated order id, or repeated broker execution id within the same account
 *       (the earliest ingested copy wins)</li>
 * </ul>
 */
@Component
public class OrderSequencer {

    private static final Logger log = LoggerFactory.getLogger(OrderSequencer.class);

    /** Ingestion order: decides which copy of a duplicate survives. */
    static final Comparator<Order> INGESTION_ORDER = Comparator.comparing(
                    Order::getIngestionSequence, Comparator.nullsLast(Comparator.<Long>naturalOrder()))
            .thenComparing(Order::getId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    /** Execution order within a group. */
    static final Comparator<Order> EXECUTION_ORDER =
            Comparator.comparing(Order::getExecutedAt).thenComparing(INGESTION_ORDER);

    public SequencedOrders sequence(Collection<Order> orders) {
        List<Order> candidates = new ArrayList<>(orders);
        candidates.sort(INGESTION_ORDER);

        Set<String> seenIds = new HashSet<>();
        Set<String> seenBrokerIds = new HashSet<>();
        List<RebuildProblem> skipped = new ArrayList<>();
        SortedMap<PositionKey, List<Order>> groups = new TreeMap<>();

        for (Order order : candidates) {
            SkipReason skipReason = validate(order, seenIds, seenBrokerIds);
            if (skipReason != null) {
                skipped.add(skippedOrder(order, skipReason));
                log.warn(
                        "Order skipped: orderId={}, symbol={}, accountId={}, reason={}",
                        order.getId(),
                        order.getSymbol(),
                        order.getAccountId(),
                        skipReason);
                continue;
            }
            groups.computeIfAbsent(order.positionKey(), k -> new ArrayList<>()).add(order);
        }

        groups.values().forEach(group -> group.sort(EXECUTION_ORDER));
        groups.replaceAll((key, group) -> Collections.unmodifiableList(group));

        log.debug(
                "Sequenced orders: total={}, groups={}, skipped={}",
                candidates.size(),
                groups.size(),
                skipped.size());
        return new SequencedOrders(Collections.unmodifiableSortedMap(groups), List.copyOf(skipped));
    }

    private SkipReason validate(Order order, Set<String> seenIds, Set<String> seenBrokerIds) {
        if (order.getId() == null || !seenIds.add(order.getId())) {
            return SkipReason.DUPLICATE_ORDER;
        }
        if (order.getStatus() != null && !order.getStatus().isExecuted()) {
            return SkipReason.NOT_EXECUTED;
        }
        if (order.getSymbol() == null || order.getSymbol().isBlank() || order.getSide() == null) {
            return SkipReason.INCOMPLETE_ORDER;
        }
        if (order.getExecutedAt() == null) {
            return SkipReason.MISSING_EXECUTION_TIME;
        }
        if (order.getQuantity() == null || order.getQuantity().signum() <= 0) {
            return SkipReason.NON_POSITIVE_QUANTITY;
        }
        if (order.getPrice() == null || order.getPrice().signum() < 0) {
            return SkipReason.MISSING_PRICE;
        }
        if (order.getBrokerOrderId() != null
                && !seenBrokerIds.add(order.getAccountId() + "|" + order.getBrokerOrderId())) {
            return SkipReason.DUPLICATE_ORDER;
        }
        return null;
    }

    public static RebuildProblem skippedOrder(Order order, SkipReason skipReason) {
        return RebuildProblem.builder()
                .type(ProblemType.SKIPPED_ORDER)
                .accountId(order.getAccountId())
                .symbol(order.getSymbol())
                .orderId(order.getId())
                .skipReason(skipReason)
                .message("Order excluded from matching: " + skipReason)
                .build();
    }
}
