package com.example.tracepipeline.queue;

import java.time.Duration;

public class JobTimeoutException extends RuntimeException {

    public JobTimeoutException(Job job, Duration timeout) {
        super("Job " + job.getId() + " (" + job.getType().getWireName() + ") exceeded timeout of "
                + timeout.toMillis() + "ms");
    }
}
