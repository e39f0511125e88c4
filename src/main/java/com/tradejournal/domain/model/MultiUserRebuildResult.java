package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.RebuildScope;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Result of a rebuild over many users (admin batch or scheduled sweep).
 *
 * <p>{@code failures} holds users whose whole call was rejected (rebuild already running,
 * full reset failed). Users never started because the job was cancelled are listed in
 * {@code cancelledUserIds}.
 */
@Data
@Builder
public class MultiUserRebuildResult {

    private String jobId;
    private RebuildScope scope;
    private boolean cancelled;
    private long durationMs;

    @Builder.Default
    private List<RebuildResult> results = new ArrayList<>();

    @Builder.Default
    private Map<String, String> failures = new LinkedHashMap<>();

    @Builder.Default
    private List<String> cancelledUserIds = new ArrayList<>();

    public int getTotalTrades() {
        return results.stream().mapToInt(RebuildResult::getTradeCount).sum();
    }
}
