package com.tradejournal.rebuild;

import com.tradejournal.domain.enums.RebuildScope;
import com.tradejournal.domain.model.MultiUserRebuildResult;
import com.tradejournal.domain.model.RebuildResult;
import com.tradejournal.exception.BaseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a list of users, {@code batchSize} at a time, on the user executor.
 *
 * <p>{@link #cancel()} stops the job from starting further batches. Users already in flight
 * run to completion, and their groups are never interrupted mid-commit. Users never started
 * are listed in the result as cancelled.
 *
 * <p>One job instance runs once.
 */
public class MultiUserRebuildJob {

    private static final Logger log = LoggerFactory.getLogger(MultiUserRebuildJob.class);

    private final String jobId;
    private final List<String> userIds;
    private final RebuildScope scope;
    private final int batchSize;
    private final TradeRebuildService tradeRebuildService;
    private final Executor userRebuildExecutor;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public MultiUserRebuildJob(
            String jobId,
            List<String> userIds,
            RebuildScope scope,
            int batchSize,
            TradeRebuildService tradeRebuildService,
            Executor userRebuildExecutor) {
        this.jobId = jobId;
        this.userIds = List.copyOf(userIds);
        this.scope = scope;
        this.batchSize = Math.max(1, batchSize);
        this.tradeRebuildService = tradeRebuildService;
        this.userRebuildExecutor = userRebuildExecutor;
    }

    public String getJobId() {
        return jobId;
    }

    public void cancel() {
        if (!cancelled.getAndSet(true)) {
            log.info("Multi-user rebuild cancellation requested: jobId={}", jobId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public MultiUserRebuildResult run() {
        long start = System.currentTimeMillis();
        log.info("Multi-user rebuild started: jobId={}, scope={}, users={}", jobId, scope, userIds.size());

        MultiUserRebuildResult result =
                MultiUserRebuildResult.builder().jobId(jobId).scope(scope).build();

        for (int from = 0; from < userIds.size(); from += batchSize) {
            List<String> batch = userIds.subList(from, Math.min(from + batchSize, userIds.size()));
            if (cancelled.get()) {
                result.getCancelledUserIds().addAll(userIds.subList(from, userIds.size()));
                break;
            }

            List<CompletableFuture<UserOutcome>> futures = new ArrayList<>(batch.size());
            for (String userId : batch) {
                futures.add(CompletableFuture.supplyAsync(() -> rebuildUser(userId), userRebuildExecutor));
            }
            for (UserOutcome outcome : futures.stream().map(CompletableFuture::join).toList()) {
                if (outcome.result() != null) {
                    result.getResults().add(outcome.result());
                } else {
                    result.getFailures().put(outcome.userId(), outcome.failure());
                }
            }
        }

        result.setCancelled(!result.getCancelledUserIds().isEmpty());
        result.setDurationMs(System.currentTimeMillis() - start);
        log.info(
                "Multi-user rebuild finished: jobId={}, completed={}, failed={}, cancelled={}, trades={}, durationMs={}",
                jobId,
                result.getResults().size(),
                result.getFailures().size(),
                result.getCancelledUserIds().size(),
                result.getTotalTrades(),
                result.getDurationMs());
        return result;
    }

    private UserOutcome rebuildUser(String userId) {
        try {
            return new UserOutcome(userId, tradeRebuildService.rebuild(userId, scope), null);
        } catch (BaseException e) {
            log.warn("User rebuild rejected: jobId={}, userId={}, reason={}", jobId, userId, e.getMessage());
            return new UserOutcome(userId, null, e.getMessage());
        } catch (RuntimeException e) {
            log.error("User rebuild failed: jobId={}, userId={}", jobId, userId, e);
            return new UserOutcome(userId, null, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private record UserOutcome(String userId, RebuildResult result, String failure) {}
}
