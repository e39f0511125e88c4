package com.tradejournal.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Redis configuration.
 *
 * <p>All keys are prefixed with "tj:" because the Redis server is shared.
 *
 * <p>Key schema:
 * <pre>
 *   tj:rebuild:lock:{userId}   → lock token of the instance rebuilding that user (TTL)
 * </pre>
 */
@Configuration
public class RedisConfig {

    /** Prefix of every key this service writes to the shared Redis server. */
    public static final String KEY_PREFIX = "tj:";

    public static final String KEY_PREFIX_REBUILD_LOCK = KEY_PREFIX + "rebuild:lock:";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(RedisSerializer.json());
        return template;
    }
}
