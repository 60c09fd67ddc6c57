package com.example.tracepipeline.queue;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 入队选项，未设置的字段使用 {@link JobType} 的默认值。
 */
@Value
@Builder
public class JobOptions {

    public static final JobOptions DEFAULTS = JobOptions.builder().build();

    QueueLane lane;

    Integer maxRetries;

    Duration timeout;

    Duration delay;
}
