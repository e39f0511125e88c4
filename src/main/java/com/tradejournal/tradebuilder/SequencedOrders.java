package com.tradejournal.tradebuilder;

import com.tradejournal.domain.model.Order;
import com.tradejournal.domain.model.RebuildProblem;
import com.tradejournal.domain.vo.PositionKey;
import java.util.List;
import java.util.SortedMap;
import lombok.Value;

/**
 * Output of {@link OrderSequencer}: matchable orders per (account, symbol) group in their
 * total execution order, plus the orders excluded from matching.
 *
 * <p>Groups iterate in {@link PositionKey} order so every downstream step sees groups, and
 * orders within a group, in the same sequence on every run.
 */
@Value
public class SequencedOrders {

    SortedMap<PositionKey, List<Order>> groups;
    List<RebuildProblem> skipped;

    public int getMatchableCount() {
        return groups.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
