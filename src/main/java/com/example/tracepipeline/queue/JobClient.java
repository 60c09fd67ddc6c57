package com.example.tracepipeline.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * 生产者入口：将载荷序列化并提交到当前 broker。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobClient {

    private final JobBroker broker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Job enqueue(JobType type, Object payload) {
        return enqueue(type, payload, JobOptions.DEFAULTS);
    }

    /**
     * 创建并入队一个新任务，未指定的选项取任务类型的默认值。
     *
     * @param type    任务类型
     * @param payload 载荷对象，序列化为 JSON
     * @param options 通道、重试、超时与延迟
     * @return 已入队的任务
     * @throws IllegalArgumentException 载荷无法序列化或选项非法
     */
    public Job enqueue(JobType type, Object payload, JobOptions options) {
        if (options.getMaxRetries() != null && options.getMaxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (options.getTimeout() != null && (options.getTimeout().isZero() || options.getTimeout().isNegative())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (options.getDelay() != null && options.getDelay().isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable payload for " + type.getWireName(), e);
        }

        Instant now = clock.instant();
        Duration delay = options.getDelay();
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .payload(json)
                .lane(options.getLane() != null ? options.getLane() : type.getDefaultLane())
                .maxRetries(options.getMaxRetries() != null ? options.getMaxRetries() : type.getDefaultMaxRetries())
                .timeout(options.getTimeout() != null ? options.getTimeout() : type.getDefaultTimeout())
                .enqueuedAt(now)
                .processAt(delay != null && !delay.isZero() ? now.plus(delay) : null)
                .build();

        enqueue(job);
        return job;
    }

    public void enqueue(Job job) {
        broker.enqueue(job);
        log.debug("Job enqueued: id={}, type={}, lane={}", job.getId(), job.getType().getWireName(),
                job.getLane().getKey());
    }
}
