package com.example.tracepipeline.notification;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内小时计数器，单实例部署使用。
 */
@Component
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "async", matchIfMissing = true)
public class InMemoryWebhookRateLimiter implements WebhookRateLimiter {

    static final DateTimeFormatter HOUR_BUCKET = DateTimeFormatter.ofPattern("yyyyMMddHH").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final Map<String, Integer> counters = new ConcurrentHashMap<>();
    private volatile String currentBucket;

    public InMemoryWebhookRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String webhookId, Integer limitPerHour) {
        if (limitPerHour == null || limitPerHour <= 0) {
            return true;
        }
        String bucket = HOUR_BUCKET.format(clock.instant());
        if (!bucket.equals(currentBucket)) {
            // 小时切换时清理过期的桶
            currentBucket = bucket;
            counters.keySet().removeIf(key -> !key.endsWith(":" + bucket));
        }

        boolean[] acquired = new boolean[1];
        counters.compute(webhookId + ":" + bucket, (key, count) -> {
            int current = count != null ? count : 0;
            if (current >= limitPerHour) {
                return current;
            }
            acquired[0] = true;
            return current + 1;
        });
        return acquired[0];
    }

    @Override
    public void release(String webhookId) {
        String key = webhookId + ":" + HOUR_BUCKET.format(clock.instant());
        counters.computeIfPresent(key, (k, count) -> count > 1 ? count - 1 : null);
    }

    int trackedBuckets() {
        return counters.size();
    }
}
