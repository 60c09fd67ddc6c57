package com.example.tracepipeline.queue;

/**
 * 不可重试的任务失败（配置错误、载荷格式错误等），抛出后任务直接归档。
 */
public class NonRetryableJobException extends RuntimeException {

    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
