package com.tradejournal.api.dto.response;

import com.tradejournal.domain.enums.RebuildScope;
import com.tradejournal.domain.model.RebuildProblem;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * DTO response for one user's rebuild.
 *
 * <p>{@code requiresAttention} is true when a group needs reconciliation or failed to commit;
 * such groups are listed in {@code problems} with their account and symbol.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RebuildResultResponse {
    private String userId;
    private RebuildScope scope;
    private LocalDateTime startedAt;
    private long durationMs;
    private int ordersConsidered;
    private int groupsProcessed;
    private int groupsRebuilt;
    private int tradeCount;
    private boolean requiresAttention;
    private List<TradeResponse> trades;
    private List<RebuildProblem> problems;
}
