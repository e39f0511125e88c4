package com.tradejournal.entity;

import com.tradejournal.domain.enums.AssetClass;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.enums.OrderStatus;
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
 * JPA entity for the orders table.
 * Brokerage executions as written by ingestion; trade rebuilds only update used_in_trade and trade_id.
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(name = "account_id", length = 64)
    private String accountId;

    @Column(name = "broker_order_id", length = 100)
    private String brokerOrderId;

    @Column(length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_class", columnDefinition = "varchar(10)")
    private AssetClass assetClass;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private OrderStatus status;

    @Column(precision = 20, scale = 8)
    private BigDecimal quantity;

    @Column(precision = 20, scale = 6)
    private BigDecimal price;

    @Column(precision = 15, scale = 4)
    private BigDecimal commission;

    @Column(precision = 15, scale = 4)
    private BigDecimal fees;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;

    @Column(name = "ingestion_sequence")
    private Long ingestionSequence;

    @Column(name = "used_in_trade", nullable = false)
    private boolean usedInTrade;

    @Column(name = "trade_id", length = 36)
    private String tradeId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
