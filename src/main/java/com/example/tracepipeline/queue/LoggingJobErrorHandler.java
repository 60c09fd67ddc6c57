package com.example.tracepipeline.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingJobErrorHandler implements JobErrorHandler {

    @Override
    public void handleError(Job job, Throwable cause, boolean archived) {
        if (archived) {
            log.error("Job archived as failed: id={}, type={}, retried={}/{}, error={}",
                    job.getId(), job.getType().getWireName(), job.getRetried(), job.getMaxRetries(),
                    cause.getMessage(), cause);
        } else {
            log.warn("Job failed, will retry: id={}, type={}, attempt={}/{}, error={}",
                    job.getId(), job.getType().getWireName(), job.getRetried(), job.getMaxRetries(),
                    cause.getMessage());
        }
    }
}
