package com.tradejournal.tradebuilder;

import com.tradejournal.domain.enums.AllocationRole;
import com.tradejournal.domain.enums.AssetClass;
import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.model.OrderAllocation;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Running totals for one trade while its events are folded. Full precision throughout;
 * rounding happens once, when {@link TradeAggregator} publishes the trade.
 */
class TradeAccumulator {

    final TradeSide side;
    final AssetClass assetClass;
    final String firstOrderId;
    final LocalDateTime entryAt;
    LocalDateTime exitAt;
    boolean closed;

    BigDecimal openQuantity = BigDecimal.ZERO;
    BigDecimal closeQuantity = BigDecimal.ZERO;
    BigDecimal entryNotional = BigDecimal.ZERO;
    BigDecimal exitNotional = BigDecimal.ZERO;

    BigDecimal commissions = BigDecimal.ZERO;
    BigDecimal fees = BigDecimal.ZERO;

    /** Commission and fees of the opening allocations, and the part already charged to P&L. */
    BigDecimal entryCostTotal = BigDecimal.ZERO;
    BigDecimal entryCostCharged = BigDecimal.ZERO;

    BigDecimal realizedPnl = BigDecimal.ZERO;

    final List<OrderAllocation> allocations = new ArrayList<>();
    final Set<String> orderIds = new LinkedHashSet<>();

    TradeAccumulator(MatchEvent openingEvent) {
        this.side = openingEvent.positionSide();
        this.assetClass = openingEvent.order().getAssetClass();
        this.firstOrderId = openingEvent.order().getId();
        this.entryAt = openingEvent.order().getExecutedAt();
        addOpening(openingEvent);
    }

    void addOpening(MatchEvent event) {
        Order order = event.order();
        BigDecimal quantity = event.quantity();
        BigDecimal commission = share(order.getCommission(), order, quantity);
        BigDecimal fee = share(order.getFees(), order, quantity);

        openQuantity = openQuantity.add(quantity);
        entryNotional = entryNotional.add(order.getPrice().multiply(quantity));
        commissions = commissions.add(commission);
        fees = fees.add(fee);
        entryCostTotal = entryCostTotal.add(commission).add(fee);
        allocate(order, quantity, AllocationRole.OPENING);
    }

    void addClosing(MatchEvent event) {
        Order order = event.order();
        BigDecimal quantity = event.quantity();
        BigDecimal commission = share(order.getCommission(), order, quantity);
        BigDecimal fee = share(order.getFees(), order, quantity);

        BigDecimal gross = order.getPrice()
                .subtract(event.entryBasis())
                .multiply(quantity)
                .multiply(BigDecimal.valueOf(side.sign()));
        // uncharged entry cost spread over the quantity still open
        BigDecimal entryCostSlice = entryCostTotal
                .subtract(entryCostCharged)
                .multiply(quantity)
                .divide(openQuantity.subtract(closeQuantity), MathContext.DECIMAL128);

        closeQuantity = closeQuantity.add(quantity);
        exitNotional = exitNotional.add(order.getPrice().multiply(quantity));
        commissions = commissions.add(commission);
        fees = fees.add(fee);
        entryCostCharged = entryCostCharged.add(entryCostSlice);
        realizedPnl = realizedPnl.add(gross).subtract(commission).subtract(fee).subtract(entryCostSlice);
        allocate(order, quantity, AllocationRole.CLOSING);
    }

    void close(MatchEvent event) {
        // settle rounding left by the closing slices
        realizedPnl = realizedPnl.subtract(entryCostTotal.subtract(entryCostCharged));
        entryCostCharged = entryCostTotal;
        exitAt = event.order().getExecutedAt();
        closed = true;
    }

    private void allocate(Order order, BigDecimal quantity, AllocationRole role) {
        allocations.add(OrderAllocation.builder()
                .orderId(order.getId())
                .role(role)
                .quantity(quantity)
                .price(order.getPrice())
                .executedAt(order.getExecutedAt())
                .sequence(allocations.size())
                .build());
        orderIds.add(order.getId());
    }

    /** Part of an order-level amount attributable to {@code quantity} of that order. */
    static BigDecimal share(BigDecimal amount, Order order, BigDecimal quantity) {
        if (amount == null || amount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (quantity.compareTo(order.getQuantity()) == 0) {
            return amount;
        }
        return amount.multiply(quantity).divide(order.getQuantity(), MathContext.DECIMAL128);
    }
}
