package com.tradejournal.tradebuilder;

import com.tradejournal.domain.vo.PositionKey;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Deterministic trade ids. A trade is identified by its group and the order that opened it;
 * no two trades in a group share an opening order, and a rebuild of unchanged orders yields
 * the same ids.
 */
public final class TradeIdGenerator {

    private TradeIdGenerator() {}

    public static String tradeId(String userId, PositionKey positionKey, String firstOrderId) {
        String name = userId + "|" + positionKey.accountId() + "|" + positionKey.symbol() + "|" + firstOrderId;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
