package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.ProblemType;
import com.tradejournal.domain.enums.RebuildScope;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one user's rebuild: the trades touched (created or replaced) plus every problem
 * found, per order or per (account, symbol) group.
 *
 * <p>An incremental run with no new orders returns an empty trade list, which is what makes
 * repeated invocations idempotent from the caller's point of view.
 */
@Data
@Builder
public class RebuildResult {

    private String userId;
    private RebuildScope scope;
    private LocalDateTime startedAt;
    private long durationMs;

    private int ordersConsidered;
    private int groupsProcessed;

    /** Groups whose incremental run fell back to a full group rebuild because of late history. */
    private int groupsRebuilt;

    @Builder.Default
    private List<Trade> trades = new ArrayList<>();

    @Builder.Default
    private List<RebuildProblem> problems = new ArrayList<>();

    public boolean hasProblems() {
        return problems != null && !problems.isEmpty();
    }

    /** True when a group needs reconciliation or a group commit failed and should be retried. */
    public boolean requiresAttention() {
        return problems != null && problems.stream().anyMatch(RebuildProblem::requiresAttention);
    }

    public List<RebuildProblem> problemsOfType(ProblemType type) {
        if (problems == null) {
            return List.of();
        }
        return problems.stream().filter(p -> p.getType() == type).toList();
    }

    public int getTradeCount() {
        return trades != null ? trades.size() : 0;
    }
}
