package com.tradejournal.tradebuilder;

import com.tradejournal.domain.model.Trade;
import com.tradejournal.domain.vo.PositionKey;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Trades constructed for one group together with the order tags that go with them.
 *
 * <p>{@code orderTags} maps every contributing order to the trade holding its last allocation,
 * which for a reversal order is the newly opened trade.
 */
@Value
public class GroupConstruction {

    PositionKey positionKey;
    List<Trade> trades;
    Map<String, String> orderTags;
}
