package com.example.tracepipeline.queue;

import lombok.Value;

/**
 * 从 broker 取出的任务租约。处理结束后必须 ack、retry 或 archive。
 */
@Value
public class JobLease {

    Job job;

    /**
     * broker 内部的消息标识（Redis Stream 记录 ID），内存模式为 null
     */
    String receipt;
}
