package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.AllocationRole;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * The part of one order attributed to one trade.
 *
 * <p>Most orders have a single allocation for their full quantity. A reversal order has two:
 * a CLOSING allocation in the trade it closes and an OPENING allocation in the trade it opens,
 * with quantities summing to the order quantity.
 */
@Value
@Builder
public class OrderAllocation {

    String orderId;
    AllocationRole role;
    BigDecimal quantity;
    BigDecimal price;
    LocalDateTime executedAt;

    /** Position of this allocation within its trade, starting at 0. */
    int sequence;
}
