package com.tradejournal.api.dto.response;

import com.tradejournal.domain.enums.AssetClass;
import com.tradejournal.domain.enums.HoldingPeriodClass;
import com.tradejournal.domain.enums.MarketSession;
import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.domain.model.OrderAllocation;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** DTO response for one reconstructed trade, including its per-order allocations. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeResponse {
    private String id;
    private String accountId;
    private String symbol;
    private AssetClass assetClass;
    private TradeSide side;
    private TradeStatus status;
    private BigDecimal openQuantity;
    private BigDecimal closeQuantity;
    private BigDecimal remainingQuantity;
    private BigDecimal avgEntryPrice;
    private BigDecimal avgExitPrice;
    private BigDecimal realizedPnl;
    private BigDecimal commissionsTotal;
    private BigDecimal feesTotal;
    private BigDecimal costBasis;
    private BigDecimal proceeds;
    private int executionsCount;
    private LocalDateTime entryAt;
    private LocalDateTime exitAt;
    private Long timeInTradeSeconds;
    private HoldingPeriodClass holdingPeriodClass;
    private MarketSession marketSession;
    private List<String> ordersInTrade;
    private List<OrderAllocation> allocations;
}
