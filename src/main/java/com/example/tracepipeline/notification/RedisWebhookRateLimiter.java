package com.example.tracepipeline.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * 基于 Redis INCR 的小时计数器，多实例共享。
 * Key: pipeline:webhook:rate:{webhookId}:{yyyyMMddHH}，首次写入时设置 2 小时过期。
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class RedisWebhookRateLimiter implements WebhookRateLimiter {

    private static final String KEY_PREFIX = "pipeline:webhook:rate:";
    private static final Duration BUCKET_TTL = Duration.ofHours(2);

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    @Override
    public boolean tryAcquire(String webhookId, Integer limitPerHour) {
        if (limitPerHour == null || limitPerHour <= 0) {
            return true;
        }
        String key = key(webhookId);
        Long count = redisTemplate.opsForValue().increment(key);
        if (count != null && count == 1) {
            redisTemplate.expire(key, BUCKET_TTL);
        }
        if (count != null && count > limitPerHour) {
            redisTemplate.opsForValue().decrement(key);
            return false;
        }
        return true;
    }

    @Override
    public void release(String webhookId) {
        String key = key(webhookId);
        // 小时桶已切换时当前桶可能不存在，DECR 会建出一个没有过期时间的 key
        if (!Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
            log.debug("Rate limit bucket {} is gone, nothing to release", key);
            return;
        }
        Long remaining = redisTemplate.opsForValue().decrement(key);
        if (remaining != null && remaining < 0) {
            // 预留属于上一个小时桶，INCR 保留现有过期时间
            redisTemplate.opsForValue().increment(key);
        }
        log.debug("Released rate limit reservation for webhook {}", webhookId);
    }

    private String key(String webhookId) {
        return KEY_PREFIX + webhookId + ":" + InMemoryWebhookRateLimiter.HOUR_BUCKET.format(clock.instant());
    }
}
