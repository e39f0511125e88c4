package com.tradejournal.unit.tradebuilder;

import static com.tradejournal.fixtures.OrderFixtures.at;
import static com.tradejournal.fixtures.OrderFixtures.buy;
import static com.tradejournal.fixtures.OrderFixtures.sell;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradejournal.domain.enums.AllocationRole;
import com.tradejournal.domain.enums.MatchEventType;
import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.model.OrderAllocation;
import com.tradejournal.domain.vo.PositionKey;
import com.tradejournal.exception.ReconciliationRequiredException;
import com.tradejournal.tradebuilder.Execution;
import com.tradejournal.tradebuilder.MatchEvent;
import com.tradejournal.tradebuilder.PositionMatcher;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PositionMatcher: state transitions, weighted entry basis,
 * reversal handling and resuming from a persisted open trade.
 */
class PositionMatcherTest {

    private PositionMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new PositionMatcher(new PositionKey("ACC-1", "AAPL"));
    }

    private List<MatchEvent> apply(Order order) {
        return matcher.apply(Execution.of(order));
    }

    private static List<MatchEventType> types(List<MatchEvent> events) {
        return events.stream().map(MatchEvent::type).toList();
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("BUY from flat opens a long position")
        void buyOpensLong() {
            List<MatchEvent> events = apply(buy("o1", "100", "10", at(10, 0)));

            assertThat(types(events)).containsExactly(MatchEventType.OPEN);
            assertThat(events.get(0).positionSide()).isEqualTo(TradeSide.LONG);
            assertThat(matcher.getPositionSide()).isEqualTo(TradeSide.LONG);
            assertThat(matcher.getOpenQuantity()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("SELL from flat opens a short position")
        void sellOpensShort() {
            List<MatchEvent> events = apply(sell("o1", "5", "10", at(10, 0)));

            assertThat(types(events)).containsExactly(MatchEventType.OPEN);
            assertThat(matcher.getPositionSide()).isEqualTo(TradeSide.SHORT);
        }

        @Test
        @DisplayName("same-direction fill scales in and reweights the entry basis")
        void scaleInReweightsBasis() {
            apply(buy("o1", "100", "10", at(10, 0)));
            List<MatchEvent> events = apply(buy("o2", "300", "12", at(10, 5)));

            assertThat(types(events)).containsExactly(MatchEventType.SCALE_IN);
            assertThat(matcher.getOpenQuantity()).isEqualByComparingTo("400");
            assertThat(matcher.getEntryBasis()).isEqualByComparingTo("11.5");
        }

        @Test
        @DisplayName("partial opposite fill scales out at the current basis without closing")
        void partialScaleOut() {
            apply(buy("o1", "100", "10", at(10, 0)));
            List<MatchEvent> events = apply(sell("o2", "40", "12", at(10, 5)));

            assertThat(types(events)).containsExactly(MatchEventType.SCALE_OUT);
            assertThat(events.get(0).quantity()).isEqualByComparingTo("40");
            assertThat(events.get(0).entryBasis()).isEqualByComparingTo("10");
            assertThat(matcher.getOpenQuantity()).isEqualByComparingTo("60");
            assertThat(matcher.isFlat()).isFalse();
        }

        @Test
        @DisplayName("opposite fill equal to the open quantity closes and returns to flat")
        void exactCloseGoesFlat() {
            apply(buy("o1", "100", "10", at(10, 0)));
            List<MatchEvent> events = apply(sell("o2", "100", "12", at(10, 5)));

            assertThat(types(events)).containsExactly(MatchEventType.SCALE_OUT, MatchEventType.CLOSE);
            assertThat(matcher.isFlat()).isTrue();
            assertThat(matcher.getEntryBasis()).isNull();
        }

        @Test
        @DisplayName("oversized opposite fill closes and flips the remainder from the same order")
        void oversizedFillFlips() {
            apply(buy("o1", "50", "10", at(10, 0)));
            Order reversal = sell("o2", "80", "11", at(10, 5));
            List<MatchEvent> events = apply(reversal);

            assertThat(types(events))
                    .containsExactly(MatchEventType.SCALE_OUT, MatchEventType.CLOSE, MatchEventType.FLIP);
            assertThat(events.get(0).quantity()).isEqualByComparingTo("50");
            assertThat(events.get(0).positionSide()).isEqualTo(TradeSide.LONG);
            assertThat(events.get(2).quantity()).isEqualByComparingTo("30");
            assertThat(events.get(2).positionSide()).isEqualTo(TradeSide.SHORT);
            assertThat(events.get(2).entryBasis()).isEqualByComparingTo("11");
            assertThat(events).allSatisfy(e -> assertThat(e.order()).isSameAs(reversal));
            assertThat(matcher.getPositionSide()).isEqualTo(TradeSide.SHORT);
            assertThat(matcher.getOpenQuantity()).isEqualByComparingTo("30");
        }

        @Test
        @DisplayName("fractional quantities are matched exactly")
        void fractionalQuantities() {
            apply(buy("o1", "0.5", "100", at(10, 0)));
            apply(buy("o2", "0.25", "110", at(10, 1)));
            List<MatchEvent> events = apply(sell("o3", "0.75", "120", at(10, 2)));

            assertThat(types(events)).containsExactly(MatchEventType.SCALE_OUT, MatchEventType.CLOSE);
            BigDecimal expectedBasis = new BigDecimal("77.5").divide(new BigDecimal("0.75"), MathContext.DECIMAL128);
            assertThat(events.get(0).entryBasis()).isEqualByComparingTo(expectedBasis);
        }

        @Test
        @DisplayName("non-positive quantity is rejected")
        void nonPositiveQuantityRejected() {
            Order order = buy("o1", "10", "10", at(10, 0));

            assertThatThrownBy(() -> matcher.apply(new Execution(order, BigDecimal.ZERO)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("o1");
        }
    }

    @Nested
    @DisplayName("Resume from open trade")
    class Resume {

        private OrderAllocation allocation(Order order, String quantity, AllocationRole role, int sequence) {
            return OrderAllocation.builder()
                    .orderId(order.getId())
                    .role(role)
                    .quantity(new BigDecimal(quantity))
                    .price(order.getPrice())
                    .executedAt(order.getExecutedAt())
                    .sequence(sequence)
                    .build();
        }

        @Test
        @DisplayName("replays opening and closing allocations into the same state")
        void replaysAllocations() {
            Order open = buy("o1", "100", "10", at(10, 0));
            Order partial = sell("o2", "40", "12", at(10, 5));

            List<MatchEvent> replayed = matcher.resume(
                    List.of(
                            allocation(open, "100", AllocationRole.OPENING, 0),
                            allocation(partial, "40", AllocationRole.CLOSING, 1)),
                    Map.of("o1", open, "o2", partial));

            assertThat(types(replayed)).containsExactly(MatchEventType.OPEN, MatchEventType.SCALE_OUT);
            assertThat(matcher.getPositionSide()).isEqualTo(TradeSide.LONG);
            assertThat(matcher.getOpenQuantity()).isEqualByComparingTo("60");
        }

        @Test
        @DisplayName("replays the opening part of a reversal order")
        void replaysFlipOpening() {
            Order reversal = sell("o2", "80", "11", at(10, 5));

            List<MatchEvent> replayed = matcher.resume(
                    List.of(allocation(reversal, "30", AllocationRole.OPENING, 0)), Map.of("o2", reversal));

            assertThat(types(replayed)).containsExactly(MatchEventType.OPEN);
            assertThat(matcher.getPositionSide()).isEqualTo(TradeSide.SHORT);
            assertThat(matcher.getOpenQuantity()).isEqualByComparingTo("30");
        }

        @Test
        @DisplayName("an open trade that starts with a closing allocation requires reconciliation")
        void closingFirstRequiresReconciliation() {
            Order order = sell("o1", "10", "11", at(10, 0));

            assertThatThrownBy(() -> matcher.resume(
                            List.of(allocation(order, "10", AllocationRole.CLOSING, 0)), Map.of("o1", order)))
                    .isInstanceOf(ReconciliationRequiredException.class);
        }

        @Test
        @DisplayName("an allocation whose order is missing requires reconciliation")
        void missingOrderRequiresReconciliation() {
            Order order = buy("o1", "10", "10", at(10, 0));

            assertThatThrownBy(() -> matcher.resume(
                            List.of(allocation(order, "10", AllocationRole.OPENING, 0)), Map.of()))
                    .isInstanceOf(ReconciliationRequiredException.class)
                    .satisfies(e -> assertThat(((ReconciliationRequiredException) e).getOrderId()).isEqualTo("o1"));
        }

        @Test
        @DisplayName("allocations that would close the open trade require reconciliation")
        void closingReplayRequiresReconciliation() {
            Order open = buy("o1", "10", "10", at(10, 0));
            Order close = sell("o2", "10", "11", at(10, 5));

            assertThatThrownBy(() -> matcher.resume(
                            List.of(
                                    allocation(open, "10", AllocationRole.OPENING, 0),
                                    allocation(close, "10", AllocationRole.CLOSING, 1)),
                            Map.of("o1", open, "o2", close)))
                    .isInstanceOf(ReconciliationRequiredException.class);
        }
    }
}
