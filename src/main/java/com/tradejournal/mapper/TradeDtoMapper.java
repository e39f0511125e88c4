package com.tradejournal.mapper;

import com.tradejournal.api.dto.response.MultiUserRebuildResponse;
import com.tradejournal.api.dto.response.RebuildResultResponse;
import com.tradejournal.api.dto.response.TradeResponse;
import com.tradejournal.domain.model.MultiUserRebuildResult;
import com.tradejournal.domain.model.RebuildResult;
import com.tradejournal.domain.model.Trade;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for trade and rebuild response DTOs.
 * Used by the TradeRebuildController layer; the domain never sees DTOs.
 */
@Mapper
public interface TradeDtoMapper {

    TradeResponse toResponse(Trade trade);

    List<TradeResponse> toTradeResponseList(List<Trade> trades);

    @Mapping(target = "requiresAttention", expression = "java(result.requiresAttention())")
    RebuildResultResponse toResponse(RebuildResult result);

    MultiUserRebuildResponse toResponse(MultiUserRebuildResult result);
}
