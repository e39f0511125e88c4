package com.tradejournal.tradebuilder;

import com.tradejournal.config.TradeBuilderConfig;
import com.tradejournal.domain.enums.ProblemType;
import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.model.OrderAllocation;
import com.tradejournal.domain.model.RebuildProblem;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.domain.vo.PositionKey;
import com.tradejournal.exception.ReconciliationRequiredException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns ordered executions into trades. A pure function of its input: no storage access,
 * no clock, so the same orders always produce the same trades.
 */
@Service
public class TradeConstructionService {

    private static final Logger log = LoggerFactory.getLogger(TradeConstructionService.class);

    private final OrderSequencer orderSequencer;
    private final TradeClassifier tradeClassifier;
    private final TradeBuilderConfig tradeBuilderConfig;

    public TradeConstructionService(
            OrderSequencer orderSequencer, TradeClassifier tradeClassifier, TradeBuilderConfig tradeBuilderConfig) {
        this.orderSequencer = orderSequencer;
        this.tradeClassifier = tradeClassifier;
        this.tradeBuilderConfig = tradeBuilderConfig;
    }

    public SequencedOrders sequence(Collection<Order> orders) {
        return orderSequencer.sequence(orders);
    }

    /**
     * Constructs the trades of one group from its orders in sequencer order.
     *
     * @param resumeFrom   persisted OPEN trade to continue, or null to start FLAT
     * @param resumeOrders orders referenced by {@code resumeFrom}'s allocations
     * @throws ReconciliationRequiredException if the group's history is inconsistent
     */
    public GroupConstruction constructGroup(
            String userId, PositionKey positionKey, Trade resumeFrom, Map<String, Order> resumeOrders, List<Order> orders) {
        PositionMatcher matcher = new PositionMatcher(positionKey);
        TradeAggregator aggregator = new TradeAggregator(userId, positionKey, tradeClassifier, tradeBuilderConfig);

        if (resumeFrom != null) {
            aggregator.acceptAll(matcher.resume(resumeFrom.getAllocations(), resumeOrders));
            log.debug(
                    "Resumed open trade: key={}, tradeId={}, openQuantity={}",
                    positionKey,
                    resumeFrom.getId(),
                    matcher.getOpenQuantity());
        }
        for (Order order : orders) {
            aggregator.acceptAll(matcher.apply(Execution.of(order)));
        }

        List<Trade> trades = aggregator.getTrades();
        return new GroupConstruction(positionKey, trades, orderTags(trades));
    }

    /**
     * Sequences and constructs a whole order set from scratch. Group failures are reported as
     * problems next to the trades of the groups that succeeded.
     */
    public ConstructionResult constructAll(String userId, Collection<Order> orders) {
        SequencedOrders sequenced = orderSequencer.sequence(orders);
        List<Trade> trades = new ArrayList<>();
        List<RebuildProblem> problems = new ArrayList<>(sequenced.getSkipped());

        sequenced.getGroups().forEach((key, groupOrders) -> {
            try {
                trades.addAll(constructGroup(userId, key, null, Map.of(), groupOrders).getTrades());
            } catch (ReconciliationRequiredException e) {
                problems.add(groupProblem(ProblemType.RECONCILIATION_REQUIRED, key, e.getOrderId(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Trade construction failed: userId={}, key={}", userId, key, e);
                problems.add(groupProblem(ProblemType.GROUP_FAILURE, key, null, e.getMessage()));
            }
        });
        return new ConstructionResult(trades, problems);
    }

    public static RebuildProblem groupProblem(ProblemType type, PositionKey key, String orderId, String message) {
        return RebuildProblem.builder()
                .type(type)
                .accountId(key.accountId())
                .symbol(key.symbol())
                .orderId(orderId)
                .message(message)
                .build();
    }

    private static Map<String, String> orderTags(List<Trade> trades) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (Trade trade : trades) {
            for (OrderAllocation allocation : trade.getAllocations()) {
                tags.put(allocation.getOrderId(), trade.getId());
            }
        }
        return tags;
    }
}
