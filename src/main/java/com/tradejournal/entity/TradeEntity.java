package com.tradejournal.entity;

import com.tradejournal.domain.enums.AssetClass;
import com.tradejournal.domain.enums.HoldingPeriodClass;
import com.tradejournal.domain.enums.MarketSession;
import com.tradejournal.domain.enums.TradeSide;
import com.tradejournal.domain.enums.TradeStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table.
 * Reconstructed round-trip positions. Rows are only ever inserted or deleted, never updated.
 * Per-order attribution lives in trade_allocations.
 */
@Entity
@Table(name = "trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(name = "account_id", length = 64)
    private String accountId;

    @Column(length = 50, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_class", columnDefinition = "varchar(10)")
    private AssetClass assetClass;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeSide side;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeStatus status;

    @Column(name = "open_quantity", precision = 20, scale = 8)
    private BigDecimal openQuantity;

    @Column(name = "close_quantity", precision = 20, scale = 8)
    private BigDecimal closeQuantity;

    @Column(name = "remaining_quantity", precision = 20, scale = 8)
    private BigDecimal remainingQuantity;

    @Column(name = "avg_entry_price", precision = 20, scale = 6)
    private BigDecimal avgEntryPrice;

    @Column(name = "avg_exit_price", precision = 20, scale = 6)
    private BigDecimal avgExitPrice;

    @Column(name = "realized_pnl", precision = 20, scale = 4)
    private BigDecimal realizedPnl;

    @Column(name = "commissions_total", precision = 15, scale = 4)
    private BigDecimal commissionsTotal;

    @Column(name = "fees_total", precision = 15, scale = 4)
    private BigDecimal feesTotal;

    @Column(name = "cost_basis", precision = 20, scale = 4)
    private BigDecimal costBasis;

    @Column(precision = 20, scale = 4)
    private BigDecimal proceeds;

    @Column(name = "executions_count")
    private int executionsCount;

    @Column(name = "entry_at")
    private LocalDateTime entryAt;

    @Column(name = "exit_at")
    private LocalDateTime exitAt;

    @Column(name = "time_in_trade_seconds")
    private Long timeInTradeSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "holding_period_class", columnDefinition = "varchar(10)")
    private HoldingPeriodClass holdingPeriodClass;

    @Enumerated(EnumType.STRING)
    @Column(name = "market_session", columnDefinition = "varchar(15)")
    private MarketSession marketSession;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
