package com.example.tracepipeline.config;

import com.example.tracepipeline.queue.QueueLane;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.stream.ReadOffset;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Redis Stream 任务队列配置：每个通道一个 Stream，共用一个消费组。
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class RedisStreamConfig {

        public static final String STREAM_PREFIX = "pipeline:jobs:";
        public static final String SCHEDULED_KEY = "pipeline:jobs:scheduled";
        public static final String DEAD_STREAM_KEY = "pipeline:jobs:dead";
        public static final String GROUP_NAME = "pipeline-workers";
        // 动态生成消费者名称，支持多实例部署
        public static final String CONSUMER_NAME = "worker-" + UUID.randomUUID().toString().substring(0, 8);

        private final RedisConnectionFactory connectionFactory;

        /**
         * 通道对应的 Stream Key。
         *
         * @param lane 通道
         * @return Stream Key
         */
        public static String streamKey(QueueLane lane) {
                return STREAM_PREFIX + lane.getKey();
        }

        /**
         * 初始化各通道的 Stream 与消费组（不存在则创建）。
         */
        @PostConstruct
        public void initStreams() {
                try (RedisConnection connection = connectionFactory.getConnection()) {
                        for (QueueLane lane : QueueLane.values()) {
                                try {
                                        connection.streamCommands().xGroupCreate(
                                                        streamKey(lane).getBytes(StandardCharsets.UTF_8),
                                                        GROUP_NAME, ReadOffset.from("0"), true);
                                        log.info("Created consumer group {} on {}", GROUP_NAME, streamKey(lane));
                                } catch (Exception e) {
                                        log.info("Stream or group already exists for {}, skipping initialization",
                                                        streamKey(lane));
                                }
                        }
                }
        }
}
