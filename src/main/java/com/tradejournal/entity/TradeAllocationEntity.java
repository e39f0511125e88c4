package com.tradejournal.entity;

import com.tradejournal.domain.enums.AllocationRole;
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
 * JPA entity for the trade_allocations table.
 * One row per (trade, order) attribution (1 trade → N allocations). A reversal order has two rows,
 * one in each trade it touches. Id is {@code tradeId:sequence}.
 */
@Entity
@Table(name = "trade_allocations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeAllocationEntity {

    @Id
    @Column(length = 48)
    private String id;

    @Column(name = "trade_id", length = 36, nullable = false)
    private String tradeId;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(name = "order_id", length = 36, nullable = false)
    private String orderId;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private AllocationRole role;

    @Column(precision = 20, scale = 8)
    private BigDecimal quantity;

    @Column(precision = 20, scale = 6)
    private BigDecimal price;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;

    @Column(name = "sequence_no")
    private int sequence;
}
