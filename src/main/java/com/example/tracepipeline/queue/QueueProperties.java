package com.example.tracepipeline.queue;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 任务队列配置，前缀 app.queue。
 */
@Data
@ConfigurationProperties(prefix = "app.queue")
public class QueueProperties {

    /** 工作线程数，默认10 */
    private int concurrency = 10;

    /** 是否随应用启动工作线程 */
    private boolean autoStartup = true;

    /** 各通道权重，critical:default:low 默认 6:3:1 */
    private int criticalWeight = 6;
    private int defaultWeight = 3;
    private int lowWeight = 1;

    /** 所有通道为空时的轮询间隔 */
    private Duration pollInterval = Duration.ofMillis(200);

    /** 重试退避：初始间隔、倍数与上限 */
    private Duration retryInitialDelay = Duration.ofSeconds(2);
    private double retryMultiplier = 2.0;
    private Duration retryMaxDelay = Duration.ofMinutes(10);

    /** Redis 模式下，Pending 消息空闲超过任务超时加此宽限期即视为消费者已失效 */
    private Duration recoveryGrace = Duration.ofMinutes(1);
}
