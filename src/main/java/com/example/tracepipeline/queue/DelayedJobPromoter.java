package com.example.tracepipeline.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 定时任务：将到期的延迟任务（含重试退避中的任务）移入对应通道。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DelayedJobPromoter {

    private final JobBroker broker;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.queue.promote-interval-ms:1000}")
    public void promoteDueJobs() {
        try {
            int promoted = broker.promoteDueJobs(clock.instant());
            if (promoted > 0) {
                log.debug("Promoted {} delayed jobs", promoted);
            }
        } catch (Exception e) {
            log.error("Error promoting delayed jobs: {}", e.getMessage(), e);
        }
    }
}
