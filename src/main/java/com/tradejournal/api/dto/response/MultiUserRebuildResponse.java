package com.tradejournal.api.dto.response;

import com.tradejournal.domain.enums.RebuildScope;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** DTO response for the admin multi-user calculation. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MultiUserRebuildResponse {
    private String jobId;
    private RebuildScope scope;
    private boolean cancelled;
    private long durationMs;
    private int totalTrades;
    private List<RebuildResultResponse> results;

    /** userId → reason the user's rebuild was rejected. */
    private Map<String, String> failures;

    private List<String> cancelledUserIds;
}
