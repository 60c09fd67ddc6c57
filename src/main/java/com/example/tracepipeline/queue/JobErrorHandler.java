package com.example.tracepipeline.queue;

/**
 * 任务失败回调。每次失败都会调用，archived 表示任务已进入死信不再重试。
 */
public interface JobErrorHandler {

    void handleError(Job job, Throwable cause, boolean archived);
}
