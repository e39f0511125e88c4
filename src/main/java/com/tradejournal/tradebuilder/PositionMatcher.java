package com.tradejournal.tradebuilder;

import com.tradejournal.domain.enums.AllocationRole;
import com.tradejournal.domain.enums.MatchEventType;
import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.model.OrderAllocation;
import com.tradejournal.domain.vo.PositionKey;
import com.tradejournal.exception.ReconciliationRequiredException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Position state machine for a single (account, symbol) group.
 *
 * <p>States are FLAT, LONG and SHORT; there is no terminal state. Executions must be applied
 * in sequencer order. Each call returns the transitions it caused:
 * <ul>
 *   <li>FLAT + any fill: OPEN</li>
 *   <li>same-direction fill: SCALE_IN (average entry recomputed from running totals)</li>
 *   <li>opposite fill up to the open quantity: SCALE_OUT, plus CLOSE when it reaches zero</li>
 *   <li>opposite fill above the open quantity: SCALE_OUT of the open quantity, CLOSE, then
 *       FLIP opening the remainder in the other direction from the same order</li>
 * </ul>
 *
 * <p>Not thread-safe. One instance per group per rebuild.
 */
public class PositionMatcher {

    private static final Logger log = LoggerFactory.getLogger(PositionMatcher.class);

    private final PositionKey positionKey;

    /** Null while FLAT. */
    private TradeSide positionSide;

    private BigDecimal openQuantity = BigDecimal.ZERO;
    private BigDecimal entryQuantity = BigDecimal.ZERO;
    private BigDecimal entryNotional = BigDecimal.ZERO;

    public PositionMatcher(PositionKey positionKey) {
        this.positionKey = positionKey;
    }

    public boolean isFlat() {
        return positionSide == null;
    }

    public TradeSide getPositionSide() {
        return positionSide;
    }

    public BigDecimal getOpenQuantity() {
        return openQuantity;
    }

    /** Weighted average entry price of the current position, or null while FLAT. */
    public BigDecimal getEntryBasis() {
        if (isFlat()) {
            return null;
        }
        return entryNotional.divide(entryQuantity, MathContext.DECIMAL128);
    }

    /**
     * Applies one execution.
     *
     * @throws IllegalArgumentException         if the quantity is not positive
     * @throws ReconciliationRequiredException  if the open quantity would become negative
     */
    public List<MatchEvent> apply(Execution execution) {
        Order order = execution.order();
        BigDecimal quantity = execution.quantity();
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException(
                    "Non-positive quantity reached matcher: orderId=" + order.getId() + ", quantity=" + quantity);
        }

        TradeSide direction = order.getSide().openingDirection();
        List<MatchEvent> events = new ArrayList<>(3);

        if (isFlat()) {
            events.add(open(MatchEventType.OPEN, direction, order, quantity));
        } else if (direction == positionSide) {
            entryQuantity = entryQuantity.add(quantity);
            entryNotional = entryNotional.add(order.getPrice().multiply(quantity));
            openQuantity = openQuantity.add(quantity);
            events.add(event(MatchEventType.SCALE_IN, order, quantity));
        } else {
            int comparison = quantity.compareTo(openQuantity);
            if (comparison <= 0) {
                events.add(reduce(order, quantity));
                if (comparison == 0) {
                    events.add(close(order));
                }
            } else {
                BigDecimal remainder = quantity.subtract(openQuantity);
                events.add(reduce(order, openQuantity));
                events.add(close(order));
                events.add(open(MatchEventType.FLIP, direction, order, remainder));
            }
        }

        if (log.isDebugEnabled()) {
            events.forEach(e -> log.debug(
                    "Match event: key={}, type={}, orderId={}, quantity={}, side={}",
                    positionKey,
                    e.type(),
                    order.getId(),
                    e.quantity(),
                    e.positionSide()));
        }
        return events;
    }

    /**
     * Re-seeds a FLAT matcher from the allocations of a persisted OPEN trade, oldest first.
     *
     * <p>Every allocation must replay to the transition its role records: the first one opens
     * the position, later OPENING allocations scale in, CLOSING allocations scale out without
     * closing. Anything else means the stored trade no longer agrees with its orders.
     *
     * @param allocations  the open trade's allocations in sequence order
     * @param ordersById   the orders those allocations refer to
     * @return the replayed events, for the aggregator to rebuild the trade from
     */
    public List<MatchEvent> resume(List<OrderAllocation> allocations, Map<String, Order> ordersById) {
        if (!isFlat()) {
            throw new IllegalStateException("Matcher for " + positionKey + " is not flat");
        }
        if (allocations.isEmpty() || allocations.get(0).getRole() != AllocationRole.OPENING) {
            throw new ReconciliationRequiredException(
                    positionKey, null, "Open trade for " + positionKey + " does not start with an opening allocation");
        }

        List<MatchEvent> replayed = new ArrayList<>();
        for (OrderAllocation allocation : allocations) {
            Order order = ordersById.get(allocation.getOrderId());
            if (order == null) {
                throw new ReconciliationRequiredException(
                        positionKey,
                        allocation.getOrderId(),
                        "Order referenced by open trade is missing: " + allocation.getOrderId());
            }
            List<MatchEvent> events = apply(new Execution(order, allocation.getQuantity()));
            if (events.size() != 1 || events.get(0).allocationRole() != allocation.getRole()) {
                throw new ReconciliationRequiredException(
                        positionKey,
                        order.getId(),
                        "Open trade for " + positionKey + " cannot be replayed at order " + order.getId());
            }
            replayed.addAll(events);
        }
        return replayed;
    }

    private MatchEvent open(MatchEventType type, TradeSide direction, Order order, BigDecimal quantity) {
        positionSide = direction;
        openQuantity = quantity;
        entryQuantity = quantity;
        entryNotional = order.getPrice().multiply(quantity);
        return event(type, order, quantity);
    }

    private MatchEvent reduce(Order order, BigDecimal quantity) {
        MatchEvent event = event(MatchEventType.SCALE_OUT, order, quantity);
        openQuantity = openQuantity.subtract(quantity);
        if (openQuantity.signum() < 0) {
            throw new ReconciliationRequiredException(
                    positionKey, order.getId(), "Open quantity for " + positionKey + " went negative");
        }
        return event;
    }

    private MatchEvent close(Order order) {
        MatchEvent event = event(MatchEventType.CLOSE, order, BigDecimal.ZERO);
        positionSide = null;
        openQuantity = BigDecimal.ZERO;
        entryQuantity = BigDecimal.ZERO;
        entryNotional = BigDecimal.ZERO;
        return event;
    }

    private MatchEvent event(MatchEventType type, Order order, BigDecimal quantity) {
        return new MatchEvent(type, order, quantity, positionSide, getEntryBasis());
    }
}
