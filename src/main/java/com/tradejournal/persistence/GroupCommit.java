package com.tradejournal.persistence;

import com.tradejournal.domain.model.Trade;
import com.tradejournal.domain.vo.PositionKey;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Unit of work for one group: which trades go away, which come in, and which order is tagged
 * with which trade. Applied all-or-nothing by {@link TradeStore#replaceGroup(GroupCommit)}.
 */
@Value
@Builder
public class GroupCommit {

    String userId;
    PositionKey positionKey;

    /** Trades to remove. Ignored when {@code replaceWholeGroup} is set. */
    @Builder.Default
    List<String> replacedTradeIds = List.of();

    /** Remove every existing trade of the group first (group-scoped rebuild). */
    boolean replaceWholeGroup;

    @Builder.Default
    List<Trade> trades = List.of();

    /** orderId to tradeId. */
    @Builder.Default
    Map<String, String> orderTags = Map.of();
}
