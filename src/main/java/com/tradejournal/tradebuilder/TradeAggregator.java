package com.tradejournal.tradebuilder;

import com.tradejournal.config.TradeBuilderConfig;
import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.domain.vo.PositionKey;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds the matcher's events for one group into trades.
 *
 * <p>OPEN and FLIP start a trade, SCALE_IN and SCALE_OUT extend it, CLOSE completes it.
 * Realized P&L of a closing slice is {@code (exit - entryBasis) * qty * sign} less the closing
 * order's proportional costs and the entry costs carried by the closed quantity; CLOSE settles
 * whatever entry cost remains, so a closed trade nets out every commission and fee exactly once.
 *
 * <p>Not thread-safe. One instance per group per rebuild.
 */
public class TradeAggregator {

    private final String userId;
    private final PositionKey positionKey;
    private final TradeClassifier tradeClassifier;
    private final TradeBuilderConfig tradeBuilderConfig;

    private final List<Trade> completed = new ArrayList<>();
    private TradeAccumulator current;

    public TradeAggregator(
            String userId,
            PositionKey positionKey,
            TradeClassifier tradeClassifier,
            TradeBuilderConfig tradeBuilderConfig) {
        this.userId = userId;
        this.positionKey = positionKey;
        this.tradeClassifier = tradeClassifier;
        this.tradeBuilderConfig = tradeBuilderConfig;
    }

    public void accept(MatchEvent event) {
        switch (event.type()) {
            case OPEN, FLIP -> {
                if (current != null) {
                    throw new IllegalStateException("Trade already open for " + positionKey);
                }
                current = new TradeAccumulator(event);
            }
            case SCALE_IN -> requireCurrent(event).addOpening(event);
            case SCALE_OUT -> requireCurrent(event).addClosing(event);
            case CLOSE -> {
                requireCurrent(event).close(event);
                completed.add(publish(current));
                current = null;
            }
        }
    }

    public void acceptAll(List<MatchEvent> events) {
        events.forEach(this::accept);
    }

    /** Closed trades in completion order, followed by the open trade if there is one. */
    public List<Trade> getTrades() {
        List<Trade> trades = new ArrayList<>(completed);
        if (current != null) {
            trades.add(publish(current));
        }
        return trades;
    }

    private TradeAccumulator requireCurrent(MatchEvent event) {
        if (current == null) {
            throw new IllegalStateException(
                    "No open trade for " + positionKey + " at " + event.type() + " of order " + event.order().getId());
        }
        return current;
    }

    private Trade publish(TradeAccumulator acc) {
        int quantityScale = tradeBuilderConfig.getQuantityScale();
        int priceScale = tradeBuilderConfig.getPriceScale();
        int amountScale = tradeBuilderConfig.getAmountScale();
        boolean hasClosed = acc.closeQuantity.signum() > 0;

        return Trade.builder()
                .id(TradeIdGenerator.tradeId(userId, positionKey, acc.firstOrderId))
                .userId(userId)
                .accountId(positionKey.accountId())
                .symbol(positionKey.symbol())
                .assetClass(acc.assetClass)
                .side(acc.side)
                .status(acc.closed ? TradeStatus.CLOSED : TradeStatus.OPEN)
                .openQuantity(acc.openQuantity.setScale(quantityScale, RoundingMode.HALF_UP))
                .closeQuantity(acc.closeQuantity.setScale(quantityScale, RoundingMode.HALF_UP))
                .remainingQuantity(acc.openQuantity.subtract(acc.closeQuantity).setScale(quantityScale, RoundingMode.HALF_UP))
                .avgEntryPrice(average(acc.entryNotional, acc.openQuantity, priceScale))
                .avgExitPrice(acc.closed ? average(acc.exitNotional, acc.closeQuantity, priceScale) : null)
                .realizedPnl(acc.realizedPnl.setScale(amountScale, RoundingMode.HALF_UP))
                .commissionsTotal(acc.commissions.setScale(amountScale, RoundingMode.HALF_UP))
                .feesTotal(acc.fees.setScale(amountScale, RoundingMode.HALF_UP))
                .costBasis(acc.entryNotional.setScale(amountScale, RoundingMode.HALF_UP))
                .proceeds(hasClosed ? acc.exitNotional.setScale(amountScale, RoundingMode.HALF_UP) : null)
                .executionsCount(acc.orderIds.size())
                .entryAt(acc.entryAt)
                .exitAt(acc.exitAt)
                .timeInTradeSeconds(acc.closed ? Duration.between(acc.entryAt, acc.exitAt).getSeconds() : null)
                .holdingPeriodClass(tradeClassifier.holdingPeriod(acc.entryAt, acc.exitAt))
                .marketSession(tradeClassifier.marketSession(acc.entryAt))
                .ordersInTrade(new ArrayList<>(acc.orderIds))
                .allocations(new ArrayList<>(acc.allocations))
                .build();
    }

    private static BigDecimal average(BigDecimal notional, BigDecimal quantity, int scale) {
        return notional.divide(quantity, MathContext.DECIMAL128).setScale(scale, RoundingMode.HALF_UP);
    }
}
