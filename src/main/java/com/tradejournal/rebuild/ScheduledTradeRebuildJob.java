package com.tradejournal.rebuild;

import com.tradejournal.config.RebuildConfig;
import com.tradejournal.domain.enums.RebuildScope;
import com.tradejournal.domain.model.MultiUserRebuildResult;
import com.tradejournal.persistence.OrderStore;
import jakarta.annotation.PreDestroy;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic incremental sweep over every user with unconsumed orders.
 * Disabled unless {@code tradejournal.rebuild.sweep-enabled=true}. A running sweep is cancelled
 * on shutdown between user batches.
 */
@Component
public class ScheduledTradeRebuildJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledTradeRebuildJob.class);

    private final TradeRebuildService tradeRebuildService;
    private final OrderStore orderStore;
    private final RebuildConfig rebuildConfig;

    private volatile MultiUserRebuildJob currentJob;

    public ScheduledTradeRebuildJob(
            TradeRebuildService tradeRebuildService, OrderStore orderStore, RebuildConfig rebuildConfig) {
        this.tradeRebuildService = tradeRebuildService;
        this.orderStore = orderStore;
        this.rebuildConfig = rebuildConfig;
    }

    @Scheduled(
            fixedDelayString = "${tradejournal.rebuild.sweep-interval-ms:300000}",
            initialDelayString = "${tradejournal.rebuild.sweep-initial-delay-ms:60000}")
    public void sweep() {
        if (!rebuildConfig.isSweepEnabled()) {
            return;
        }
        runSweep();
    }

    /** Runs one sweep regardless of the enabled flag. Returns null when there is nothing to do. */
    public MultiUserRebuildResult runSweep() {
        List<String> userIds = orderStore.findUsersWithUnconsumedOrders();
        if (userIds.isEmpty()) {
            log.debug("Rebuild sweep: no users with unconsumed orders");
            return null;
        }

        MultiUserRebuildJob job = tradeRebuildService.newMultiUserJob(userIds, RebuildScope.INCREMENTAL);
        currentJob = job;
        try {
            MultiUserRebuildResult result = job.run();
            log.info(
                    "Rebuild sweep done: users={}, trades={}, failures={}",
                    userIds.size(),
                    result.getTotalTrades(),
                    result.getFailures().size());
            return result;
        } finally {
            currentJob = null;
        }
    }

    @PreDestroy
    public void stop() {
        MultiUserRebuildJob job = currentJob;
        if (job != null) {
            job.cancel();
        }
    }
}
