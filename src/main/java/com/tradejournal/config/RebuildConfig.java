package com.tradejournal.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the rebuild service and its callers.
 * Properties are read from the {@code tradejournal.rebuild} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "tradejournal.rebuild")
@Getter
@Setter
public class RebuildConfig {

    /** Hold the per-user rebuild lock in Redis as well as in-process. */
    private boolean distributedLockEnabled = true;

    /** Expiry of the Redis lock, so a crashed instance cannot block a user forever. */
    private Duration lockTtl = Duration.ofMinutes(10);

    /** Users processed concurrently by a multi-user job. */
    private int userPoolSize = 4;

    /** (account, symbol) groups processed concurrently within one user's rebuild. */
    private int groupPoolSize = 8;

    private int queueCapacity = 500;

    /** Users per batch in a multi-user job; cancellation is checked between batches. */
    private int batchSize = 20;

    /** Whether the periodic incremental sweep runs. */
    private boolean sweepEnabled = false;
}
