package com.example.tracepipeline.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Cron 调度：每次触发都入队一个新任务，不关心队列积压，也不跟踪上一次是否完成。
 * 表达式为 Spring 6 段格式，按 UTC 计算。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CronJobScheduler {

    private final TaskScheduler taskScheduler;
    private final JobClient jobClient;

    /**
     * 注册周期任务。
     *
     * @param cronExpression  cron 表达式，如 "0 0 1 * * *"
     * @param type            任务类型
     * @param payloadSupplier 每次触发时生成载荷
     * @return 调度句柄，可用于取消
     * @throws IllegalArgumentException 表达式非法
     */
    public ScheduledFuture<?> schedule(String cronExpression, JobType type, Supplier<Object> payloadSupplier) {
        CronTrigger trigger = new CronTrigger(cronExpression, ZoneOffset.UTC);
        log.info("Scheduled cron job: type={}, cron='{}'", type.getWireName(), cronExpression);
        return taskScheduler.schedule(() -> fire(type, payloadSupplier), trigger);
    }

    void fire(JobType type, Supplier<Object> payloadSupplier) {
        try {
            Job job = jobClient.enqueue(type, payloadSupplier.get());
            log.info("Cron enqueued job: id={}, type={}", job.getId(), type.getWireName());
        } catch (Exception e) {
            log.error("Cron failed to enqueue {}: {}", type.getWireName(), e.getMessage(), e);
        }
    }
}
