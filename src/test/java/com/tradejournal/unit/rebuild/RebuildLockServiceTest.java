package com.tradejournal.unit.rebuild;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradejournal.config.RebuildConfig;
import com.tradejournal.rebuild.RebuildLockService;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RebuildLockServiceTest {

    private static final String USER = "user-1";
    private static final String KEY = "tj:rebuild:lock:user-1";

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    private RebuildConfig rebuildConfig;
    private RebuildLockService rebuildLockService;

    @BeforeEach
    void setUp() {
        rebuildConfig = new RebuildConfig();
        rebuildConfig.setLockTtl(Duration.ofMinutes(5));
        rebuildLockService = new RebuildLockService(redisTemplate, rebuildConfig);
    }

    private String acquire() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(KEY), anyString(), eq(Duration.ofMinutes(5)))).thenReturn(true);
        assertThat(rebuildLockService.tryLock(USER)).isTrue();

        ArgumentCaptor<Object> token = ArgumentCaptor.forClass(Object.class);
        verify(valueOperations).setIfAbsent(eq(KEY), token.capture(), any(Duration.class));
        return (String) token.getValue();
    }

    @Test
    @DisplayName("acquires the Redis key with the configured TTL")
    void acquiresRedisKey() {
        acquire();

        assertThat(rebuildLockService.isLocked(USER)).isTrue();
    }

    @Test
    @DisplayName("second attempt on the same instance is rejected without a Redis round trip")
    void localHolderRejectsSecondAttempt() {
        acquire();

        assertThat(rebuildLockService.tryLock(USER)).isFalse();
        verify(valueOperations).setIfAbsent(anyString(), any(), any(Duration.class));
    }

    @Test
    @DisplayName("key held by another instance: rejected and the local entry is released")
    void heldByAnotherInstance() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(KEY), anyString(), any(Duration.class))).thenReturn(false);

        assertThat(rebuildLockService.tryLock(USER)).isFalse();
        assertThat(rebuildLockService.isLocked(USER)).isFalse();
    }

    @Test
    @DisplayName("Redis failure while acquiring propagates and leaves the user unlocked")
    void redisFailurePropagates() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(KEY), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> rebuildLockService.tryLock(USER))
                .isInstanceOf(RedisConnectionFailureException.class);
        assertThat(rebuildLockService.isLocked(USER)).isFalse();
    }

    @Test
    @DisplayName("unlock deletes the key only while it still holds our token")
    void unlockDeletesOwnToken() {
        String token = acquire();
        when(valueOperations.get(KEY)).thenReturn(token);

        rebuildLockService.unlock(USER);

        verify(redisTemplate).delete(KEY);
        assertThat(rebuildLockService.isLocked(USER)).isFalse();
    }

    @Test
    @DisplayName("unlock leaves a key re-acquired by someone else after expiry")
    void unlockKeepsForeignToken() {
        acquire();
        when(valueOperations.get(KEY)).thenReturn("someone-else");

        rebuildLockService.unlock(USER);

        verify(redisTemplate, never()).delete(anyString());
        assertThat(rebuildLockService.tryLock(USER)).isTrue();
    }

    @Test
    @DisplayName("Redis failure while releasing is logged, not thrown")
    void unlockFailureTolerated() {
        acquire();
        when(valueOperations.get(KEY)).thenThrow(new RedisConnectionFailureException("down"));

        rebuildLockService.unlock(USER);

        assertThat(rebuildLockService.isLocked(USER)).isFalse();
    }

    @Test
    @DisplayName("with distributed locking disabled only the in-process guard applies")
    void localOnly() {
        rebuildConfig.setDistributedLockEnabled(false);

        assertThat(rebuildLockService.tryLock(USER)).isTrue();
        assertThat(rebuildLockService.tryLock(USER)).isFalse();
        rebuildLockService.unlock(USER);
        assertThat(rebuildLockService.tryLock(USER)).isTrue();

        verifyNoInteractions(redisTemplate);
    }
}
