package com.example.tracepipeline.queue;

import com.example.tracepipeline.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobBrokerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryJobBroker broker = new InMemoryJobBroker(clock);

    private Job job(String id, QueueLane lane, Instant processAt) {
        return Job.builder()
                .id(id)
                .type(JobType.COST_CALCULATION)
                .payload("{}")
                .lane(lane)
                .maxRetries(3)
                .processAt(processAt)
                .build();
    }

    @Test
    void testLanesAreFifoAndIndependent() {
        broker.enqueue(job("a", QueueLane.DEFAULT, null));
        broker.enqueue(job("b", QueueLane.DEFAULT, null));
        broker.enqueue(job("c", QueueLane.CRITICAL, null));

        assertThat(broker.poll(QueueLane.DEFAULT).get().getJob().getId()).isEqualTo("a");
        assertThat(broker.poll(QueueLane.CRITICAL).get().getJob().getId()).isEqualTo("c");
        assertThat(broker.poll(QueueLane.DEFAULT).get().getJob().getId()).isEqualTo("b");
        assertThat(broker.poll(QueueLane.LOW)).isEmpty();
    }

    @Test
    void testDelayedJobWaitsUntilDue() {
        broker.enqueue(job("later", QueueLane.LOW, NOW.plusSeconds(60)));

        assertThat(broker.poll(QueueLane.LOW)).isEmpty();
        assertThat(broker.stats().getScheduled()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(60));
        assertThat(broker.promoteDueJobs(clock.instant())).isEqualTo(1);
        assertThat(broker.poll(QueueLane.LOW)).isPresent();
    }

    @Test
    void testArchiveKeepsDeadJobs() {
        Job failed = job("x", QueueLane.DEFAULT, null).toBuilder().lastError("boom").build();
        broker.archive(new JobLease(failed, null), failed);

        assertThat(broker.stats().getDead()).isEqualTo(1);
        assertThat(broker.deadJobs()).extracting(Job::getLastError).containsExactly("boom");
    }

    @Test
    void testDeadListIsBounded() {
        for (int i = 0; i < InMemoryJobBroker.MAX_DEAD_JOBS + 5; i++) {
            Job failed = job("d" + i, QueueLane.DEFAULT, null);
            broker.archive(new JobLease(failed, null), failed);
        }

        assertThat(broker.deadJobs()).hasSize(InMemoryJobBroker.MAX_DEAD_JOBS);
        assertThat(broker.deadJobs().get(0).getId()).isEqualTo("d5");
    }
}
