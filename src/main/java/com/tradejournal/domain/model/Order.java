package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.AssetClass;
import com.tradejournal.domain.enums.OrderSide;
import com.tradejournal.domain.enums.OrderStatus;
import com.tradejournal.domain.vo.PositionKey;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A single brokerage execution (fill) as normalized by ingestion.
 *
 * <p>Orders are immutable once recorded. The only fields ever written after ingestion are
 * {@code usedInTrade} and {@code tradeId}, and only by the rebuild service inside the same
 * transaction that persists the trade the order belongs to.
 *
 * <p>{@code executedAt} is exchange-local time. {@code ingestionSequence} is the monotonic
 * ingestion counter that breaks ties between fills sharing a timestamp.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String id;
    private String userId;
    private String accountId;

    /** Broker-reported execution id. Used to drop duplicate imports of the same fill. */
    private String brokerOrderId;

    private String symbol;
    private AssetClass assetClass;
    private OrderSide side;
    private OrderStatus status;

    /** Positive; fractional quantities are allowed for brokers that support them. */
    private BigDecimal quantity;

    private BigDecimal price;
    private BigDecimal commission;
    private BigDecimal fees;

    private LocalDateTime executedAt;
    private Long ingestionSequence;

    private boolean usedInTrade;

    /** Trade holding this order's last attributed quantity. Null until the order is consumed. */
    private String tradeId;

    private LocalDateTime createdAt;

    public PositionKey positionKey() {
        return new PositionKey(accountId, symbol);
    }
}
