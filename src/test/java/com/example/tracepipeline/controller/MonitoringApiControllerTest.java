package com.example.tracepipeline.controller;

import com.example.tracepipeline.queue.InMemoryJobBroker;
import com.example.tracepipeline.queue.JobClient;
import com.example.tracepipeline.queue.JobOptions;
import com.example.tracepipeline.queue.JobServer;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.resilience.CircuitBreakerRegistry;
import com.example.tracepipeline.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MonitoringApiControllerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-15T10:00:00Z"));
    private final InMemoryJobBroker broker = new InMemoryJobBroker(clock);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MonitoringApiController controller = new MonitoringApiController(broker,
            new CircuitBreakerRegistry(clock, meterRegistry), meterRegistry);

    @Test
    void testQueueDepths() {
        JobClient client = new JobClient(broker, new ObjectMapper(), clock);
        client.enqueue(JobType.NOTIFICATION_SEND, Map.of());
        client.enqueue(JobType.EVALUATION, Map.of());
        client.enqueue(JobType.EVALUATION, Map.of(), JobOptions.builder().delay(Duration.ofMinutes(5)).build());

        Map<String, Object> queues = controller.getQueues();

        assertThat(queues.get("lanes")).isEqualTo(Map.of("critical", 1L, "default", 1L, "low", 0L));
        assertThat(queues.get("scheduled")).isEqualTo(1L);
        assertThat(queues.get("dead")).isEqualTo(0L);
    }

    @Test
    void testJobOutcomes() {
        meterRegistry.counter(JobServer.METRIC_NAME, "type", "eval:run", "outcome", "succeeded").increment(3);
        meterRegistry.counter(JobServer.METRIC_NAME, "type", "eval:run", "outcome", "retried").increment();
        meterRegistry.counter(JobServer.METRIC_NAME, "type", "notification:send", "outcome", "archived").increment();

        Map<String, Map<String, Long>> outcomes = controller.getJobOutcomes();

        assertThat(outcomes).containsOnlyKeys("eval:run", "notification:send");
        assertThat(outcomes.get("eval:run")).containsEntry("succeeded", 3L).containsEntry("retried", 1L);
        assertThat(outcomes.get("notification:send")).containsEntry("archived", 1L);
    }
}
