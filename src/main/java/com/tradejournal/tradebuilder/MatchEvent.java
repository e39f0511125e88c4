package com.tradejournal.tradebuilder;

import com.tradejournal.domain.enums.AllocationRole;
import com.tradejournal.domain.enums.MatchEventType;
import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.model.Order;
import java.math.BigDecimal;

/**
 * A position transition emitted by {@link PositionMatcher}.
 *
 * @param type         transition kind
 * @param order        source execution
 * @param quantity     quantity of {@code order} involved; zero for CLOSE
 * @param positionSide direction of the position after OPEN / SCALE_IN / FLIP, or of the
 *                     position being reduced for SCALE_OUT / CLOSE
 * @param entryBasis   weighted average entry price of the position at the time of the event
 */
public record MatchEvent(
        MatchEventType type, Order order, BigDecimal quantity, TradeSide positionSide, BigDecimal entryBasis) {

    /** Allocation role recorded for this event, or null for CLOSE which moves no quantity. */
    public AllocationRole allocationRole() {
        return switch (type) {
            case OPEN, SCALE_IN, FLIP -> AllocationRole.OPENING;
            case SCALE_OUT -> AllocationRole.CLOSING;
            case CLOSE -> null;
        };
    }
}
