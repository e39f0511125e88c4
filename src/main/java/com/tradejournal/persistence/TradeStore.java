package com.tradejournal.persistence;

import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.domain.vo.PositionKey;
import com.tradejournal.exception.AtomicityFailureException;
import com.tradejournal.exception.ReconciliationRequiredException;
import java.util.List;
import java.util.Optional;

/** Trades of a user, replaced per group in one transaction together with the order tags. */
public interface TradeStore {

    /**
     * @throws ReconciliationRequiredException if the group has more than one OPEN trade
     */
    Optional<Trade> findOpenTrade(String userId, PositionKey positionKey);

    /** Trades ordered by entry time; {@code status} null means all. */
    List<Trade> findTrades(String userId, TradeStatus status);

    /** Removes every trade and allocation of the user and clears all of the user's order tags. */
    void deleteAllForUser(String userId);

    /**
     * Atomically removes the replaced trades, inserts the new ones and tags their orders.
     *
     * @throws AtomicityFailureException if any step fails; nothing is changed in that case
     */
    void replaceGroup(GroupCommit commit);
}
