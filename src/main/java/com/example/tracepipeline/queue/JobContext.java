package com.example.tracepipeline.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 单次执行的上下文：任务本身、执行截止时间与载荷解析。
 */
public class JobContext {

    private final Job job;
    private final Instant deadline;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public JobContext(Job job, Instant deadline, Clock clock, ObjectMapper objectMapper) {
        this.job = job;
        this.deadline = deadline;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    public Job getJob() {
        return job;
    }

    /**
     * 当前是第几次重试，首次执行为 0。
     */
    public int getRetryCount() {
        return job.getRetried();
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * 距截止时间的剩余时长，已超时返回 {@link Duration#ZERO}。
     *
     * @return 剩余时长
     */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * 将 JSON 载荷解析为指定类型。格式错误的载荷重试也无济于事，按不可重试处理。
     *
     * @param type 目标类型
     * @return 解析结果
     * @throws NonRetryableJobException 载荷无法解析
     */
    public <T> T payloadAs(Class<T> type) {
        if (job.getPayload() == null || job.getPayload().isBlank()) {
            throw new NonRetryableJobException("Empty payload for job " + job.getId());
        }
        try {
            return objectMapper.readValue(job.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new NonRetryableJobException("Malformed payload for " + job.getType().getWireName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }
}
