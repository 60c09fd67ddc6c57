package com.example.tracepipeline.queue;

import com.example.tracepipeline.config.RedisStreamConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis Stream 的 broker，支持多实例共享队列。
 * 待执行任务写入通道 Stream，延迟任务写入有序集合，死信写入独立 Stream。
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class RedisStreamJobBroker implements JobBroker {

    static final String JOB_FIELD = "job";
    private static final int PROMOTE_BATCH_SIZE = 100;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 入队。Redis 连接抖动时自动重试。
     */
    @Override
    @Retryable(retryFor = RedisConnectionFailureException.class, maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2.0))
    public void enqueue(Job job) {
        String json = toJson(job);
        if (job.isDelayed(clock.instant())) {
            redisTemplate.opsForZSet().add(RedisStreamConfig.SCHEDULED_KEY, json, job.getProcessAt().toEpochMilli());
            return;
        }
        redisTemplate.opsForStream().add(RedisStreamConfig.streamKey(job.getLane()),
                Collections.singletonMap(JOB_FIELD, json));
    }

    @Override
    public Optional<JobLease> poll(QueueLane lane) {
        String streamKey = RedisStreamConfig.streamKey(lane);
        List<MapRecord<String, Object, Object>> records = redisTemplate.opsForStream().read(
                Consumer.from(RedisStreamConfig.GROUP_NAME, RedisStreamConfig.CONSUMER_NAME),
                StreamReadOptions.empty().count(1),
                StreamOffset.create(streamKey, ReadOffset.lastConsumed()));

        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }

        MapRecord<String, Object, Object> record = records.get(0);
        Object raw = record.getValue().get(JOB_FIELD);
        try {
            Job job = objectMapper.readValue(String.valueOf(raw), Job.class);
            return Optional.of(new JobLease(job, record.getId().getValue()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            // 无法解析的消息直接转入死信，避免反复投递
            log.error("Unreadable job record {} on {}, moving to dead letters", record.getId(), streamKey, e);
            Map<String, String> deadPayload = new HashMap<>();
            deadPayload.put(JOB_FIELD, String.valueOf(raw));
            deadPayload.put("_errorReason", "Unreadable job: " + e.getMessage());
            deadPayload.put("_movedAt", clock.instant().toString());
            redisTemplate.opsForStream().add(RedisStreamConfig.DEAD_STREAM_KEY, deadPayload);
            acknowledge(streamKey, record.getId().getValue());
            return Optional.empty();
        }
    }

    @Override
    public void ack(JobLease lease) {
        acknowledge(RedisStreamConfig.streamKey(lease.getJob().getLane()), lease.getReceipt());
    }

    @Override
    public void retry(JobLease lease, Job next) {
        enqueue(next);
        ack(lease);
    }

    @Override
    public void archive(JobLease lease, Job failed) {
        Map<String, String> deadPayload = new HashMap<>();
        deadPayload.put(JOB_FIELD, toJson(failed));
        deadPayload.put("_errorReason", String.valueOf(failed.getLastError()));
        deadPayload.put("_movedAt", clock.instant().toString());
        if (lease.getReceipt() != null) {
            deadPayload.put("_originalId", lease.getReceipt());
        }

        RecordId deadId = redisTemplate.opsForStream().add(RedisStreamConfig.DEAD_STREAM_KEY, deadPayload);
        log.warn("Job moved to dead letters: id={}, type={}, deadId={}, reason={}",
                failed.getId(), failed.getType(), deadId, failed.getLastError());
        ack(lease);
    }

    @Override
    public int promoteDueJobs(Instant now) {
        Set<String> due = redisTemplate.opsForZSet().rangeByScore(
                RedisStreamConfig.SCHEDULED_KEY, 0, now.toEpochMilli(), 0, PROMOTE_BATCH_SIZE);
        if (due == null || due.isEmpty()) {
            return 0;
        }

        int promoted = 0;
        for (String json : due) {
            // 多实例同时迁移时，只有 ZREM 成功的实例负责写入通道
            Long removed = redisTemplate.opsForZSet().remove(RedisStreamConfig.SCHEDULED_KEY, json);
            if (removed == null || removed == 0) {
                continue;
            }
            try {
                Job job = objectMapper.readValue(json, Job.class);
                redisTemplate.opsForStream().add(RedisStreamConfig.streamKey(job.getLane()),
                        Collections.singletonMap(JOB_FIELD, json));
                promoted++;
            } catch (JsonProcessingException e) {
                log.error("Dropping unreadable scheduled job: {}", e.getMessage());
            }
        }
        return promoted;
    }

    @Override
    public QueueStats stats() {
        Map<QueueLane, Long> pending = new EnumMap<>(QueueLane.class);
        for (QueueLane lane : QueueLane.values()) {
            pending.put(lane, nullToZero(redisTemplate.opsForStream().size(RedisStreamConfig.streamKey(lane))));
        }
        return QueueStats.builder()
                .pending(pending)
                .scheduled(nullToZero(redisTemplate.opsForZSet().size(RedisStreamConfig.SCHEDULED_KEY)))
                .dead(nullToZero(redisTemplate.opsForStream().size(RedisStreamConfig.DEAD_STREAM_KEY)))
                .build();
    }

    /**
     * 确认并删除 Stream 中的记录。
     *
     * @param streamKey Stream Key
     * @param recordId  记录 ID
     */
    void acknowledge(String streamKey, String recordId) {
        if (recordId == null) {
            return;
        }
        redisTemplate.opsForStream().acknowledge(streamKey, RedisStreamConfig.GROUP_NAME, recordId);
        redisTemplate.opsForStream().delete(streamKey, recordId);
        log.debug("Job record acknowledged: {}", recordId);
    }

    private String toJson(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + job.getId(), e);
        }
    }

    private static long nullToZero(Long value) {
        return value != null ? value : 0;
    }
}
