package com.tradejournal.unit.tradebuilder;

import static com.tradejournal.fixtures.OrderFixtures.USER;
import static com.tradejournal.fixtures.OrderFixtures.at;
import static com.tradejournal.fixtures.OrderFixtures.buy;
import static com.tradejournal.fixtures.OrderFixtures.inSymbol;
import static com.tradejournal.fixtures.OrderFixtures.sell;
import static com.tradejournal.fixtures.OrderFixtures.withCosts;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.config.TradeBuilderConfig;
import com.tradejournal.domain.enums.AllocationRole;
import com.tradejournal.domain.enums.HoldingPeriodClass;
import com.tradejournal.domain.enums.MarketSession;
import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.model.OrderAllocation;
import com.tradejournal.domain.model.RebuildProblem;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.domain.vo.PositionKey;
import com.tradejournal.tradebuilder.ConstructionResult;
import com.tradejournal.tradebuilder.GroupConstruction;
import com.tradejournal.tradebuilder.OrderSequencer;
import com.tradejournal.tradebuilder.TradeClassifier;
import com.tradejournal.tradebuilder.TradeConstructionService;
import com.tradejournal.tradebuilder.TradeIdGenerator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TradeConstructionService and the aggregation behind it: round trips,
 * partial closes, reversals, cost attribution and determinism.
 */
class TradeConstructionServiceTest {

    private static final PositionKey KEY = new PositionKey("ACC-1", "AAPL");

    private TradeConstructionService tradeConstructionService;

    @BeforeEach
    void setUp() {
        TradeBuilderConfig config = new TradeBuilderConfig();
        tradeConstructionService =
                new TradeConstructionService(new OrderSequencer(), new TradeClassifier(config), config);
    }

    private List<Trade> construct(Order... orders) {
        ConstructionResult result = tradeConstructionService.constructAll(USER, List.of(orders));
        assertThat(result.getProblems()).isEmpty();
        return result.getTrades();
    }

    @Nested
    @DisplayName("Round trips")
    class RoundTrips {

        @Test
        @DisplayName("BUY 100@10 then SELL 100@12 closes one long trade netting all costs")
        void simpleRoundTrip() {
            List<Trade> trades = construct(
                    withCosts(buy("o1", "100", "10", at(10, 0)), "1", "0.5"),
                    withCosts(sell("o2", "100", "12", at(14, 0)), "1", "0.5"));

            assertThat(trades).hasSize(1);
            Trade trade = trades.get(0);
            assertThat(trade.getStatus()).isEqualTo(TradeStatus.CLOSED);
            assertThat(trade.getSide()).isEqualTo(TradeSide.LONG);
            assertThat(trade.getOpenQuantity()).isEqualByComparingTo("100");
            assertThat(trade.getCloseQuantity()).isEqualByComparingTo("100");
            assertThat(trade.getRemainingQuantity()).isEqualByComparingTo("0");
            assertThat(trade.getAvgEntryPrice()).isEqualByComparingTo("10");
            assertThat(trade.getAvgExitPrice()).isEqualByComparingTo("12");
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("197");
            assertThat(trade.getCommissionsTotal()).isEqualByComparingTo("2");
            assertThat(trade.getFeesTotal()).isEqualByComparingTo("1");
            assertThat(trade.getCostBasis()).isEqualByComparingTo("1000");
            assertThat(trade.getProceeds()).isEqualByComparingTo("1200");
            assertThat(trade.getExecutionsCount()).isEqualTo(2);
            assertThat(trade.getOrdersInTrade()).containsExactly("o1", "o2");
            assertThat(trade.getEntryAt()).isEqualTo(at(10, 0));
            assertThat(trade.getExitAt()).isEqualTo(at(14, 0));
            assertThat(trade.getTimeInTradeSeconds()).isEqualTo(4 * 3600L);
            assertThat(trade.getHoldingPeriodClass()).isEqualTo(HoldingPeriodClass.INTRADAY);
            assertThat(trade.getMarketSession()).isEqualTo(MarketSession.REGULAR);
        }

        @Test
        @DisplayName("short round trip profits when the exit is lower")
        void shortRoundTrip() {
            List<Trade> trades = construct(sell("o1", "10", "20", at(10, 0)), buy("o2", "10", "18", at(11, 0)));

            assertThat(trades).singleElement().satisfies(trade -> {
                assertThat(trade.getSide()).isEqualTo(TradeSide.SHORT);
                assertThat(trade.getStatus()).isEqualTo(TradeStatus.CLOSED);
                assertThat(trade.getRealizedPnl()).isEqualByComparingTo("20");
            });
        }

        @Test
        @DisplayName("scale-ins close against the weighted average entry")
        void scaleInThenClose() {
            List<Trade> trades = construct(
                    buy("o1", "100", "10", at(10, 0)),
                    buy("o2", "100", "12", at(10, 30)),
                    sell("o3", "200", "13", at(11, 0)));

            Trade trade = trades.get(0);
            assertThat(trade.getAvgEntryPrice()).isEqualByComparingTo("11");
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("400");
            assertThat(trade.getExecutionsCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("a closed trade's P&L equals gross minus every commission and fee")
        void entryCostsSettleOnClose() {
            List<Trade> trades = construct(
                    withCosts(buy("o1", "100", "10", at(10, 0)), "1", "0"),
                    sell("o2", "50", "11", at(10, 10)),
                    withCosts(buy("o3", "100", "10", at(10, 20)), "1", "0"),
                    sell("o4", "150", "11", at(10, 30)));

            Trade trade = trades.get(0);
            assertThat(trade.getStatus()).isEqualTo(TradeStatus.CLOSED);
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("198");
            assertThat(trade.getCommissionsTotal()).isEqualByComparingTo("2");
        }
    }

    @Nested
    @DisplayName("Open and partially closed trades")
    class OpenTrades {

        @Test
        @DisplayName("BUY 100@10 then SELL 40@12 leaves an open trade with P&L on the closed 40")
        void partialClose() {
            List<Trade> trades = construct(
                    withCosts(buy("o1", "100", "10", at(10, 0)), "1", "0"),
                    withCosts(sell("o2", "40", "12", at(11, 0)), "1", "0"));

            Trade trade = trades.get(0);
            assertThat(trade.getStatus()).isEqualTo(TradeStatus.OPEN);
            assertThat(trade.getSide()).isEqualTo(TradeSide.LONG);
            assertThat(trade.getOpenQuantity()).isEqualByComparingTo("100");
            assertThat(trade.getCloseQuantity()).isEqualByComparingTo("40");
            assertThat(trade.getRemainingQuantity()).isEqualByComparingTo("60");
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("78.6");
            assertThat(trade.getAvgExitPrice()).isNull();
            assertThat(trade.getExitAt()).isNull();
            assertThat(trade.getTimeInTradeSeconds()).isNull();
            assertThat(trade.getProceeds()).isEqualByComparingTo("480");
        }

        @Test
        @DisplayName("a partial close before a costless scale-in is charged only the cost still uncharged")
        void partialCloseBeforeScaleIn() {
            List<Trade> trades = construct(
                    withCosts(buy("o1", "1", "10", at(10, 0)), "100", "0"),
                    sell("o2", "0.5", "10", at(10, 5)),
                    buy("o3", "99", "10", at(10, 10)),
                    sell("o4", "99", "10", at(10, 15)));

            Trade trade = trades.get(0);
            assertThat(trade.getStatus()).isEqualTo(TradeStatus.OPEN);
            assertThat(trade.getCloseQuantity()).isEqualByComparingTo("99.5");
            assertThat(trade.getRemainingQuantity()).isEqualByComparingTo("0.5");
            assertThat(trade.getCommissionsTotal()).isEqualByComparingTo("100");
            // 50 on the first half unit, then 99 of the 99.5 units left share the other 50
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("-99.7487");
            assertThat(trade.getRealizedPnl().negate()).isLessThanOrEqualTo(trade.getCommissionsTotal());
        }

        @Test
        @DisplayName("an open trade without closes carries no P&L and defaults to INTRADAY")
        void openWithoutCloses() {
            List<Trade> trades = construct(withCosts(buy("o1", "10", "10", at(10, 0)), "1", "1"));

            Trade trade = trades.get(0);
            assertThat(trade.getRealizedPnl()).isEqualByComparingTo("0");
            assertThat(trade.getProceeds()).isNull();
            assertThat(trade.getHoldingPeriodClass()).isEqualTo(HoldingPeriodClass.INTRADAY);
        }
    }

    @Nested
    @DisplayName("Reversals")
    class Reversals {

        @Test
        @DisplayName("LONG 50@10 then SELL 80@11 closes the long and opens a 30 short from the same order")
        void flip() {
            GroupConstruction construction = tradeConstructionService.constructGroup(
                    USER,
                    KEY,
                    null,
                    Map.of(),
                    List.of(
                            withCosts(buy("o1", "50", "10", at(10, 0)), "1", "0"),
                            withCosts(sell("o2", "80", "11", at(10, 30)), "1.6", "0")));

            List<Trade> trades = construction.getTrades();
            assertThat(trades).hasSize(2);

            Trade closed = trades.get(0);
            assertThat(closed.getStatus()).isEqualTo(TradeStatus.CLOSED);
            assertThat(closed.getSide()).isEqualTo(TradeSide.LONG);
            assertThat(closed.getCloseQuantity()).isEqualByComparingTo("50");
            assertThat(closed.getRealizedPnl()).isEqualByComparingTo("48");
            assertThat(closed.getCommissionsTotal()).isEqualByComparingTo("2");
            assertThat(closed.getOrdersInTrade()).containsExactly("o1", "o2");

            Trade opened = trades.get(1);
            assertThat(opened.getStatus()).isEqualTo(TradeStatus.OPEN);
            assertThat(opened.getSide()).isEqualTo(TradeSide.SHORT);
            assertThat(opened.getOpenQuantity()).isEqualByComparingTo("30");
            assertThat(opened.getAvgEntryPrice()).isEqualByComparingTo("11");
            assertThat(opened.getCommissionsTotal()).isEqualByComparingTo("0.6");
            assertThat(opened.getOrdersInTrade()).containsExactly("o2");

            BigDecimal allocatedFromReversal = trades.stream()
                    .flatMap(t -> t.getAllocations().stream())
                    .filter(a -> a.getOrderId().equals("o2"))
                    .map(OrderAllocation::getQuantity)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            assertThat(allocatedFromReversal).isEqualByComparingTo("80");
            assertThat(closed.getAllocations()).extracting(OrderAllocation::getRole)
                    .containsExactly(AllocationRole.OPENING, AllocationRole.CLOSING);
            assertThat(opened.getAllocations()).extracting(OrderAllocation::getRole)
                    .containsExactly(AllocationRole.OPENING);

            assertThat(construction.getOrderTags())
                    .containsEntry("o1", closed.getId())
                    .containsEntry("o2", opened.getId());
        }

        @Test
        @DisplayName("reversal of exactly the open quantity is a plain close")
        void exactReversalIsClose() {
            List<Trade> trades = construct(buy("o1", "50", "10", at(10, 0)), sell("o2", "50", "11", at(10, 30)));

            assertThat(trades).singleElement().extracting(Trade::getStatus).isEqualTo(TradeStatus.CLOSED);
        }
    }

    @Nested
    @DisplayName("Identity and determinism")
    class Determinism {

        @Test
        @DisplayName("trade ids derive from user, group and first order")
        void deterministicIds() {
            List<Trade> trades = construct(buy("o1", "10", "10", at(10, 0)), sell("o2", "15", "11", at(10, 30)));

            assertThat(trades.get(0).getId()).isEqualTo(TradeIdGenerator.tradeId(USER, KEY, "o1"));
            assertThat(trades.get(1).getId()).isEqualTo(TradeIdGenerator.tradeId(USER, KEY, "o2"));
        }

        @Test
        @DisplayName("the same orders in any input order produce identical trades")
        void inputOrderIndependent() {
            List<Order> orders = new ArrayList<>(List.of(
                    withCosts(buy("o1", "100", "10", at(10, 0)), "1", "0.1"),
                    withCosts(sell("o2", "30", "10.5", at(10, 5)), "1", "0.1"),
                    buy("o3", "20", "9.75", at(10, 10)),
                    sell("o4", "150", "10.25", at(10, 15)),
                    buy("o5", "60", "10", at(10, 20)),
                    inSymbol(buy("o6", "5", "300", at(10, 0)), "MSFT")));

            List<Trade> first = tradeConstructionService.constructAll(USER, orders).getTrades();
            Collections.reverse(orders);
            List<Trade> second = tradeConstructionService.constructAll(USER, orders).getTrades();

            assertThat(second).usingRecursiveFieldByFieldElementComparator().isEqualTo(first);
        }

        @Test
        @DisplayName("trades never mix symbols or accounts")
        void groupsStaySeparate() {
            List<Trade> trades = construct(
                    buy("o1", "10", "10", at(10, 0)),
                    inSymbol(sell("o2", "10", "11", at(10, 5)), "MSFT"),
                    buy("o3", "10", "10", at(10, 0)).toBuilder().accountId("ACC-2").build());

            assertThat(trades).hasSize(3);
            assertThat(trades).allSatisfy(t -> assertThat(t.getStatus()).isEqualTo(TradeStatus.OPEN));
        }

        @Test
        @DisplayName("skipped orders are reported next to the trades")
        void skippedOrdersReported() {
            ConstructionResult result = tradeConstructionService.constructAll(
                    USER, List.of(buy("o1", "10", "10", at(10, 0)), buy("o2", "10", "10", null)));

            assertThat(result.getTrades()).hasSize(1);
            assertThat(result.getProblems()).extracting(RebuildProblem::getOrderId).containsExactly("o2");
        }
    }
}
