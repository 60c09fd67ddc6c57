package com.example.tracepipeline.worker;

import com.example.tracepipeline.queue.CronJobScheduler;
import com.example.tracepipeline.queue.JobType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 内置周期任务：每日成本汇总与每日成本报告（UTC）。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BuiltInCronJobs {

    private final CronJobScheduler cronJobScheduler;

    @Value("${app.cron.enabled:true}")
    private boolean enabled;

    @Value("${app.cron.daily-cost-aggregation:0 0 1 * * *}")
    private String dailyCostAggregationCron;

    @Value("${app.cron.daily-cost-report:0 30 1 * * *}")
    private String dailyCostReportCron;

    @EventListener(ApplicationReadyEvent.class)
    public void register() {
        if (!enabled) {
            log.info("Built-in cron jobs disabled");
            return;
        }
        // 空载荷：所有项目、昨天
        cronJobScheduler.schedule(dailyCostAggregationCron, JobType.DAILY_COST_AGGREGATION, Map::of);
        cronJobScheduler.schedule(dailyCostReportCron, JobType.DAILY_COST_REPORT, Map::of);
    }
}
