package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.ProblemType;
import com.tradejournal.domain.enums.SkipReason;
import lombok.Builder;
import lombok.Data;

/**
 * A single issue surfaced by a rebuild, scoped to an order or an (account, symbol) group.
 *
 * <p>Rebuilds never hide which group failed behind one generic exception; each failure is
 * reported here with the account and symbol it belongs to, next to the trades that did succeed.
 */
@Data
@Builder
public class RebuildProblem {

    private ProblemType type;
    private String accountId;
    private String symbol;

    /** Set for SKIPPED_ORDER, and for group failures traced to a specific order. */
    private String orderId;

    /** Set for SKIPPED_ORDER only. */
    private SkipReason skipReason;

    private String message;

    public boolean requiresAttention() {
        return type != null && type.requiresAttention();
    }
}
