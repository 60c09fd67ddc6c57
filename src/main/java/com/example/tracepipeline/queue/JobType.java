package com.example.tracepipeline.queue;

import java.time.Duration;

/**
 * 所有任务类型。每种类型自带默认通道、重试次数与超时。
 */
public enum JobType {
    COST_CALCULATION("cost:calculate", QueueLane.DEFAULT, 3, Duration.ofMinutes(1)),
    BATCH_COST_CALCULATION("cost:calculate-batch", QueueLane.DEFAULT, 3, Duration.ofMinutes(5)),
    DAILY_COST_AGGREGATION("cost:aggregate-daily", QueueLane.LOW, 3, Duration.ofMinutes(10)),
    EVALUATION("eval:run", QueueLane.DEFAULT, 3, Duration.ofMinutes(5)),
    BATCH_EVALUATION("eval:run-batch", QueueLane.LOW, 3, Duration.ofMinutes(30)),
    NOTIFICATION_SEND("notification:send", QueueLane.CRITICAL, 3, Duration.ofSeconds(30)),
    THRESHOLD_CHECK("notification:check_thresholds", QueueLane.DEFAULT, 3, Duration.ofSeconds(30)),
    DAILY_COST_REPORT("notification:daily_cost_report", QueueLane.LOW, 3, Duration.ofMinutes(5));

    private final String wireName;
    private final QueueLane defaultLane;
    private final int defaultMaxRetries;
    private final Duration defaultTimeout;

    JobType(String wireName, QueueLane defaultLane, int defaultMaxRetries, Duration defaultTimeout) {
        this.wireName = wireName;
        this.defaultLane = defaultLane;
        this.defaultMaxRetries = defaultMaxRetries;
        this.defaultTimeout = defaultTimeout;
    }

    public String getWireName() {
        return wireName;
    }

    public QueueLane getDefaultLane() {
        return defaultLane;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /**
     * 根据线上名称（如 "eval:run"）解析任务类型。
     *
     * @param wireName 线上名称
     * @return 任务类型
     * @throws IllegalArgumentException 未知类型
     */
    public static JobType fromWireName(String wireName) {
        for (JobType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + wireName);
    }
}
