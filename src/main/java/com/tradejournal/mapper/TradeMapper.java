package com.tradejournal.mapper;

import com.tradejournal.domain.model.OrderAllocation;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.entity.TradeAllocationEntity;
import com.tradejournal.entity.TradeEntity;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between Trade domain model and its two tables.
 *
 * <p>The domain Trade carries its allocations inline; the database keeps them in
 * trade_allocations. {@code ordersInTrade} is not stored at all: it is the distinct order ids
 * of the allocations in sequence order.
 */
@Mapper
public interface TradeMapper {

    @Mapping(target = "createdAt", ignore = true)
    TradeEntity toEntity(Trade trade);

    @Mapping(target = "allocations", ignore = true)
    @Mapping(target = "ordersInTrade", ignore = true)
    Trade toDomain(TradeEntity entity);

    OrderAllocation toAllocation(TradeAllocationEntity entity);

    List<OrderAllocation> toAllocations(List<TradeAllocationEntity> entities);

    /** Reassemble a trade from its row and its allocation rows, already in sequence order. */
    default Trade toDomain(TradeEntity entity, List<TradeAllocationEntity> allocationEntities) {
        Trade trade = toDomain(entity);
        List<OrderAllocation> allocations = toAllocations(allocationEntities);
        trade.setAllocations(new ArrayList<>(allocations));
        trade.setOrdersInTrade(new ArrayList<>(allocations.stream()
                .map(OrderAllocation::getOrderId)
                .distinct()
                .toList()));
        return trade;
    }

    default List<TradeAllocationEntity> toAllocationEntities(Trade trade) {
        List<TradeAllocationEntity> entities = new ArrayList<>(trade.getAllocations().size());
        for (OrderAllocation allocation : trade.getAllocations()) {
            entities.add(TradeAllocationEntity.builder()
                    .id(trade.getId() + ":" + allocation.getSequence())
                    .tradeId(trade.getId())
                    .userId(trade.getUserId())
                    .orderId(allocation.getOrderId())
                    .role(allocation.getRole())
                    .quantity(allocation.getQuantity())
                    .price(allocation.getPrice())
                    .executedAt(allocation.getExecutedAt())
                    .sequence(allocation.getSequence())
                    .build());
        }
        return entities;
    }
}
