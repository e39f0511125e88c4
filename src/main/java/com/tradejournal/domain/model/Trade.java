package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.AssetClass;
import com.tradejournal.domain.enums.HoldingPeriodClass;
import com.tradejournal.domain.enums.MarketSession;
import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.domain.vo.PositionKey;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * A reconstructed round-trip position: from the first opening fill to full closure, or still open.
 *
 * <p>Trades are derived data. They are never edited field by field; every rebuild constructs
 * fresh trades from orders and swaps them in atomically together with the order tags.
 *
 * <p>An OPEN trade has {@code closeQuantity < openQuantity}, a null {@code avgExitPrice} and
 * {@code exitAt}, and a {@code realizedPnl} covering only the quantity closed so far.
 * A CLOSED trade has {@code openQuantity == closeQuantity}.
 */
@Data
@Builder(toBuilder = true)
public class Trade {

    /** Name-based UUID of user, account, symbol and first order id. Stable across rebuilds. */
    private String id;

    private String userId;
    private String accountId;
    private String symbol;
    private AssetClass assetClass;

    /** Direction of the opening leg. */
    private TradeSide side;

    private TradeStatus status;

    private BigDecimal openQuantity;
    private BigDecimal closeQuantity;
    private BigDecimal remainingQuantity;

    private BigDecimal avgEntryPrice;
    private BigDecimal avgExitPrice;

    /** Net of commissions and fees attributed to the closed quantity. */
    private BigDecimal realizedPnl;

    private BigDecimal commissionsTotal;
    private BigDecimal feesTotal;

    /** Entry notional: sum of price * quantity over opening allocations. */
    private BigDecimal costBasis;

    /** Exit notional over closing allocations. Null until something has been closed. */
    private BigDecimal proceeds;

    /** Distinct orders contributing to this trade. */
    private int executionsCount;

    private LocalDateTime entryAt;
    private LocalDateTime exitAt;
    private Long timeInTradeSeconds;

    private HoldingPeriodClass holdingPeriodClass;
    private MarketSession marketSession;

    /** Contributing order ids in attribution order, each exactly once. */
    @Builder.Default
    private List<String> ordersInTrade = new ArrayList<>();

    @Builder.Default
    private List<OrderAllocation> allocations = new ArrayList<>();

    private LocalDateTime createdAt;

    public PositionKey positionKey() {
        return new PositionKey(accountId, symbol);
    }

    public boolean isOpen() {
        return status == TradeStatus.OPEN;
    }
}
