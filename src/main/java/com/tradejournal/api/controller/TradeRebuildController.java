package com.tradejournal.api.controller;

import com.tradejournal.api.dto.request.CalculateTradesRequest;
import com.tradejournal.api.dto.response.ApiResponse;
import com.tradejournal.api.dto.response.MultiUserRebuildResponse;
import com.tradejournal.api.dto.response.RebuildResultResponse;
import com.tradejournal.api.dto.response.TradeResponse;
import com.tradejournal.domain.enums.TradeStatus;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.mapper.TradeDtoMapper;
import com.tradejournal.rebuild.TradeRebuildService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for trade reconstruction.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/users/{userId}/trades/process} -- incremental rebuild</li>
 *   <li>{@code POST /api/users/{userId}/trades/rebuild} -- full rebuild</li>
 *   <li>{@code GET /api/users/{userId}/trades?status=} -- list trades</li>
 *   <li>{@code POST /api/admin/trades/calculate} -- incremental rebuild for many users</li>
 * </ul>
 *
 * <p>Group failures come back with HTTP 200 inside the result ({@code requiresAttention});
 * a rebuild already running for the user is rejected with 409.
 */
@RestController
@RequestMapping("/api")
public class TradeRebuildController {

    private final TradeRebuildService tradeRebuildService;

    private final TradeDtoMapper tradeDtoMapper = Mappers.getMapper(TradeDtoMapper.class);

    public TradeRebuildController(TradeRebuildService tradeRebuildService) {
        this.tradeRebuildService = tradeRebuildService;
    }

    @PostMapping("/users/{userId}/trades/process")
    public RebuildResultResponse processOrders(@PathVariable String userId) {
        return tradeDtoMapper.toResponse(tradeRebuildService.processUserOrders(userId));
    }

    @PostMapping("/users/{userId}/trades/rebuild")
    public RebuildResultResponse rebuildAll(@PathVariable String userId) {
        return tradeDtoMapper.toResponse(tradeRebuildService.rebuildAllTrades(userId));
    }

    @GetMapping("/users/{userId}/trades")
    public ApiResponse<List<TradeResponse>> getTrades(
            @PathVariable String userId, @RequestParam(required = false) TradeStatus status) {
        List<Trade> trades = tradeRebuildService.findTrades(userId, status);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("count", trades.size());
        meta.put("status", status != null ? status.name() : "ALL");
        return ApiResponse.of(tradeDtoMapper.toTradeResponseList(trades), meta);
    }

    @PostMapping("/admin/trades/calculate")
    public MultiUserRebuildResponse calculate(@RequestBody @Valid CalculateTradesRequest request) {
        return tradeDtoMapper.toResponse(tradeRebuildService.processUsers(request.getUserIds()));
    }
}
