package com.tradejournal.rebuild;

import com.tradejournal.config.RebuildConfig;
import com.tradejournal.config.RedisConfig;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Per-user mutual exclusion for trade rebuilds.
 *
 * <p>Two layers: an in-process map rejects a second rebuild of the same user on this instance
 * without a Redis round trip, and a Redis {@code SET NX} with TTL excludes other instances.
 * The Redis value is a random token so that only the holder releases the key; the TTL frees
 * the user if the holder dies mid-rebuild.
 *
 * <p>Key schema: {@code tj:rebuild:lock:{userId}}
 */
@Service
public class RebuildLockService {

    private static final Logger log = LoggerFactory.getLogger(RebuildLockService.class);

    public static final String KEY_PREFIX = RedisConfig.KEY_PREFIX_REBUILD_LOCK;

    private final RedisTemplate<String, Object> redisTemplate;
    private final RebuildConfig rebuildConfig;

    /** userId → token of the rebuild running on this instance. */
    private final Map<String, String> localLocks = new ConcurrentHashMap<>();

    public RebuildLockService(RedisTemplate<String, Object> redisTemplate, RebuildConfig rebuildConfig) {
        this.redisTemplate = redisTemplate;
        this.rebuildConfig = rebuildConfig;
    }

    /**
     * @return true if the caller now holds the user's lock and must call {@link #unlock(String)}
     */
    public boolean tryLock(String userId) {
        String token = UUID.randomUUID().toString();
        if (localLocks.putIfAbsent(userId, token) != null) {
            log.debug("Rebuild lock held locally: userId={}", userId);
            return false;
        }
        if (!rebuildConfig.isDistributedLockEnabled()) {
            return true;
        }

        Boolean acquired;
        try {
            acquired = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + userId, token, rebuildConfig.getLockTtl());
        } catch (DataAccessException e) {
            localLocks.remove(userId, token);
            throw e;
        }
        if (!Boolean.TRUE.equals(acquired)) {
            localLocks.remove(userId, token);
            log.debug("Rebuild lock held by another instance: userId={}", userId);
            return false;
        }
        return true;
    }

    public void unlock(String userId) {
        String token = localLocks.remove(userId);
        if (token == null || !rebuildConfig.isDistributedLockEnabled()) {
            return;
        }
        String key = KEY_PREFIX + userId;
        try {
            Object current = redisTemplate.opsForValue().get(key);
            if (token.equals(current)) {
                redisTemplate.delete(key);
            }
        } catch (DataAccessException e) {
            // the key expires on its own after lockTtl
            log.warn("Failed to release rebuild lock: userId={}, key={}", userId, key, e);
        }
    }

    public boolean isLocked(String userId) {
        return localLocks.containsKey(userId);
    }
}
