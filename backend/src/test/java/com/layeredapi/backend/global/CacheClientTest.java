package com.layeredapi.backend.global;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import com.layeredapi.backend.global.cache.CacheClient;
import com.layeredapi.backend.global.cache.CacheProperties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class CacheClientTest {

    @Mock
    private ObjectProvider<StringRedisTemplate> templateProvider;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Test
    void disabledCacheIsANoOp() {
        CacheClient client = new CacheClient(new CacheProperties(false), templateProvider);

        client.set("k", "v", Duration.ofMinutes(1));

        assertThat(client.isEnabled()).isFalse();
        assertThat(client.get("k")).isEmpty();
        assertThat(client.exists("k")).isFalse();
        assertThat(client.delete("k")).isZero();
        assertThat(client.ping()).isFalse();
        verifyNoInteractions(templateProvider);
    }

    @Test
    void setAndGetGoThroughValueOperations() {
        when(templateProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("greeting")).thenReturn("hello");
        CacheClient client = new CacheClient(new CacheProperties(true), templateProvider);

        client.set("greeting", "hello", Duration.ofSeconds(30));

        verify(valueOperations).set("greeting", "hello", Duration.ofSeconds(30));
        assertThat(client.get("greeting")).contains("hello");
    }

    @Test
    void deleteAndExistsDelegateToTemplate() {
        when(templateProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.delete(List.of("a", "b"))).thenReturn(2L);
        when(redisTemplate.hasKey("a")).thenReturn(true);
        CacheClient client = new CacheClient(new CacheProperties(true), templateProvider);

        assertThat(client.delete("a", "b")).isEqualTo(2L);
        assertThat(client.exists("a")).isTrue();
    }

    @Test
    void unreachableRedisDegradesToMissesAndNoOps() {
        when(templateProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        RedisConnectionFailureException down = new RedisConnectionFailureException("connection refused");
        when(valueOperations.get("k")).thenThrow(down);
        doThrow(down).when(valueOperations).set("k", "v", Duration.ofMinutes(1));
        when(redisTemplate.delete(List.of("k"))).thenThrow(down);
        when(redisTemplate.hasKey("k")).thenThrow(down);
        CacheClient client = new CacheClient(new CacheProperties(true), templateProvider);

        assertThatCode(() -> client.set("k", "v", Duration.ofMinutes(1))).doesNotThrowAnyException();
        assertThat(client.get("k")).isEmpty();
        assertThat(client.delete("k")).isZero();
        assertThat(client.exists("k")).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void pingReportsUnreachableRedisAsFalse() {
        when(templateProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.execute(any(RedisCallback.class), anyBoolean()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        CacheClient client = new CacheClient(new CacheProperties(true), templateProvider);

        assertThat(client.ping()).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void pingReportsPongAsTrue() {
        when(templateProvider.getIfAvailable()).thenReturn(redisTemplate);
        when(redisTemplate.execute(any(RedisCallback.class), anyBoolean())).thenReturn("PONG");
        CacheClient client = new CacheClient(new CacheProperties(true), templateProvider);

        assertThat(client.ping()).isTrue();
    }
}
