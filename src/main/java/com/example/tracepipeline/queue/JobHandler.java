package com.example.tracepipeline.queue;

/**
 * 任务处理器。每个 {@link JobType} 恰好对应一个处理器 Bean。
 * 任务至少投递一次，实现必须幂等。
 */
public interface JobHandler {

    /**
     * @return 处理的任务类型
     */
    JobType type();

    /**
     * 执行任务。正常返回即成功；抛出 {@link NonRetryableJobException} 直接归档，其他异常按重试预算重试。
     *
     * @param context 执行上下文
     * @throws Exception 处理失败
     */
    void handle(JobContext context) throws Exception;
}
