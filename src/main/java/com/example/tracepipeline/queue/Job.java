package com.example.tracepipeline.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 一个异步任务单元。
 * 任务至少投递一次（at-least-once），处理器必须幂等。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    private String id;

    private JobType type;

    /**
     * JSON 载荷，按任务类型解析
     */
    private String payload;

    private QueueLane lane;

    private int maxRetries;

    private Duration timeout;

    /**
     * 已重试次数，首次执行为 0
     */
    @Builder.Default
    private int retried = 0;

    /**
     * 最早可执行时间，null 表示立即执行
     */
    private Instant processAt;

    private Instant enqueuedAt;

    private String lastError;

    /**
     * 重试预算是否已用尽。
     *
     * @return true 表示不再重试
     */
    @JsonIgnore
    public boolean isRetryExhausted() {
        return retried >= maxRetries;
    }

    /**
     * 是否仍需等待。
     *
     * @param now 当前时间
     * @return true 表示尚未到达执行时间
     */
    public boolean isDelayed(Instant now) {
        return processAt != null && processAt.isAfter(now);
    }
}
