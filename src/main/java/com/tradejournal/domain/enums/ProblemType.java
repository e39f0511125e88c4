package com.tradejournal.domain.enums;

/**
 * Classification of issues reported by a rebuild.
 *
 * <p>SKIPPED_ORDER and GROUP_FAILURE are recovered locally. RECONCILIATION_REQUIRED and
 * ATOMICITY_FAILURE mark the user's result as requiring attention.
 */
public enum ProblemType {
    SKIPPED_ORDER,
    GROUP_FAILURE,
    RECONCILIATION_REQUIRED,
    ATOMICITY_FAILURE;

    public boolean requiresAttention() {
        return this == RECONCILIATION_REQUIRED || this == ATOMICITY_FAILURE;
    }
}
