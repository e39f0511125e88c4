package com.tradejournal.mapper;

import com.tradejournal.domain.model.Order;
import com.tradejournal.entity.OrderEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from OrderEntity to the Order domain model. Read-only: orders are written by
 * ingestion, and rebuilds only touch their tags through bulk updates.
 */
@Mapper
public interface OrderMapper {

    Order toDomain(OrderEntity entity);

    List<Order> toDomainList(List<OrderEntity> entities);
}
