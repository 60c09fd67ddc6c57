package com.example.tracepipeline.queue;

import com.example.tracepipeline.config.RedisStreamConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.PendingMessagesSummary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * 定时任务：恢复 Pending List 中长时间未确认的任务。
 * 消费者在执行中宕机时，任务会留在消费组的 Pending List 中。
 * 空闲时间超过任务超时加宽限期后，XCLAIM 到当前消费者，按一次失败重新入队或归档。
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class PendingJobRecoveryTask {

    // 每个通道每次最多检查多少条
    private static final int MAX_RECOVER_COUNT = 100;

    private final StringRedisTemplate redisTemplate;
    private final RedisStreamJobBroker broker;
    private final ObjectMapper objectMapper;
    private final QueueProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.queue.recovery-interval-ms:30000}")
    public void recoverPendingJobs() {
        for (QueueLane lane : QueueLane.values()) {
            try {
                recoverLane(lane);
            } catch (Exception e) {
                log.error("Error during pending job recovery on lane {}: {}", lane.getKey(), e.getMessage(), e);
            }
        }
    }

    void recoverLane(QueueLane lane) throws Exception {
        String streamKey = RedisStreamConfig.streamKey(lane);
        PendingMessagesSummary summary = redisTemplate.opsForStream().pending(streamKey, RedisStreamConfig.GROUP_NAME);
        if (summary == null || summary.getTotalPendingMessages() == 0) {
            return;
        }

        // 查看整个消费组（包括已失效的其他实例）的 Pending 消息
        PendingMessages pendingMessages = redisTemplate.opsForStream().pending(
                streamKey, RedisStreamConfig.GROUP_NAME, Range.unbounded(), MAX_RECOVER_COUNT);

        for (PendingMessage pm : pendingMessages) {
            List<MapRecord<String, Object, Object>> records = redisTemplate.opsForStream()
                    .range(streamKey, Range.closed(pm.getIdAsString(), pm.getIdAsString()));
            if (records == null || records.isEmpty()) {
                continue;
            }

            Job job = objectMapper.readValue(
                    String.valueOf(records.get(0).getValue().get(RedisStreamJobBroker.JOB_FIELD)), Job.class);
            Duration timeout = job.getTimeout() != null ? job.getTimeout() : job.getType().getDefaultTimeout();
            Duration staleAfter = timeout.plus(properties.getRecoveryGrace());
            if (pm.getElapsedTimeSinceLastDelivery().compareTo(staleAfter) <= 0) {
                continue;
            }

            // XCLAIM 带最小空闲时间，多实例并发恢复时只有一个实例成功
            List<MapRecord<String, Object, Object>> claimed = redisTemplate.opsForStream().claim(
                    streamKey, RedisStreamConfig.GROUP_NAME, RedisStreamConfig.CONSUMER_NAME,
                    staleAfter, pm.getId());
            if (claimed == null || claimed.isEmpty()) {
                continue;
            }

            log.info("Recovering stale job: id={}, type={}, idle={}ms, deliveryCount={}",
                    job.getId(), job.getType().getWireName(),
                    pm.getElapsedTimeSinceLastDelivery().toMillis(), pm.getTotalDeliveryCount());

            JobLease lease = new JobLease(job, pm.getIdAsString());
            String error = "Lease expired after " + staleAfter.toMillis() + "ms without acknowledgement";
            if (job.isRetryExhausted()) {
                broker.archive(lease, job.toBuilder().lastError(error).build());
            } else {
                broker.retry(lease, job.toBuilder()
                        .retried(job.getRetried() + 1)
                        .lastError(error)
                        .processAt(clock.instant())
                        .build());
            }
        }
    }
}
