package com.tradejournal.rebuild;

import com.tradejournal.domain.enums.ProblemType;
import com.tradejournal.domain.model.RebuildProblem;
import com.tradejournal.domain.model.RebuildResult;
import com.tradejournal.event.TradesRebuiltEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Surfaces group-level rebuild problems. Skipped orders are already logged one by one by the
 * sequencer; this handler reports the groups that produced no trades.
 */
@Component
public class RebuildProblemAlertHandler {

    private static final Logger log = LoggerFactory.getLogger(RebuildProblemAlertHandler.class);

    @EventListener
    public void onTradesRebuilt(TradesRebuiltEvent event) {
        RebuildResult result = event.getResult();
        if (!result.hasProblems()) {
            return;
        }

        for (RebuildProblem problem : result.getProblems()) {
            if (problem.getType() == ProblemType.SKIPPED_ORDER) {
                continue;
            }
            if (problem.requiresAttention()) {
                log.error(
                        "Rebuild needs attention: userId={}, type={}, accountId={}, symbol={}, orderId={}, message={}",
                        result.getUserId(),
                        problem.getType(),
                        problem.getAccountId(),
                        problem.getSymbol(),
                        problem.getOrderId(),
                        problem.getMessage());
            } else {
                log.warn(
                        "Rebuild group failed: userId={}, accountId={}, symbol={}, message={}",
                        result.getUserId(),
                        problem.getAccountId(),
                        problem.getSymbol(),
                        problem.getMessage());
            }
        }

        int skipped = result.problemsOfType(ProblemType.SKIPPED_ORDER).size();
        if (skipped > 0) {
            log.info("Rebuild skipped orders: userId={}, skipped={}", result.getUserId(), skipped);
        }
    }
}
