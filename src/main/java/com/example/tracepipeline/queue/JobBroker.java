package com.example.tracepipeline.queue;

import java.time.Instant;
import java.util.Optional;

/**
 * 任务存储：按通道保存待执行任务、延迟任务与死信。
 */
public interface JobBroker {

    /**
     * 保存任务；{@code processAt} 在未来的任务进入延迟集合。
     *
     * @param job 任务
     */
    void enqueue(Job job);

    /**
     * 从指定通道取出一个任务（非阻塞）。
     *
     * @param lane 通道
     * @return 任务租约，通道为空时返回 empty
     */
    Optional<JobLease> poll(QueueLane lane);

    /**
     * 确认任务已完成。
     *
     * @param lease 租约
     */
    void ack(JobLease lease);

    /**
     * 以新的任务实例重新入队，并确认旧租约。
     *
     * @param lease 旧租约
     * @param next  下一次执行的任务
     */
    void retry(JobLease lease, Job next);

    /**
     * 将任务移入死信并确认旧租约。
     *
     * @param lease  租约
     * @param failed 带有失败原因的任务
     */
    void archive(JobLease lease, Job failed);

    /**
     * 将到期的延迟任务移入对应通道。
     *
     * @param now 当前时间
     * @return 迁移数量
     */
    int promoteDueJobs(Instant now);

    QueueStats stats();
}
