package com.tradejournal.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pools for rebuilds.
 *
 * <p>Users are independent, so a multi-user job fans out on {@code userRebuildExecutor}.
 * Within one user, (account, symbol) groups fan out on {@code groupRebuildExecutor}.
 * Both pools run saturated work on the caller thread rather than dropping it, which also keeps
 * a user task that waits on its groups from starving the group pool.
 */
@Configuration
public class AsyncConfig {

    private final RebuildConfig rebuildConfig;

    public AsyncConfig(RebuildConfig rebuildConfig) {
        this.rebuildConfig = rebuildConfig;
    }

    @Bean("userRebuildExecutor")
    public ThreadPoolTaskExecutor userRebuildExecutor() {
        return buildExecutor(rebuildConfig.getUserPoolSize(), "rebuild-user-");
    }

    @Bean("groupRebuildExecutor")
    public ThreadPoolTaskExecutor groupRebuildExecutor() {
        return buildExecutor(rebuildConfig.getGroupPoolSize(), "rebuild-group-");
    }

    private ThreadPoolTaskExecutor buildExecutor(int poolSize, String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(rebuildConfig.getQueueCapacity());
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }
}
