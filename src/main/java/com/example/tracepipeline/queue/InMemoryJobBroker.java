package com.example.tracepipeline.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 进程内 broker，单实例部署使用。进程重启后未完成的任务会丢失。
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "async", matchIfMissing = true)
public class InMemoryJobBroker implements JobBroker {

    static final int MAX_DEAD_JOBS = 1000;

    private final Clock clock;
    private final Map<QueueLane, ConcurrentLinkedQueue<Job>> lanes = new EnumMap<>(QueueLane.class);
    private final PriorityQueue<Job> scheduled = new PriorityQueue<>(Comparator.comparing(Job::getProcessAt));
    private final Deque<Job> dead = new ArrayDeque<>();

    public InMemoryJobBroker(Clock clock) {
        this.clock = clock;
        for (QueueLane lane : QueueLane.values()) {
            lanes.put(lane, new ConcurrentLinkedQueue<>());
        }
    }

    @Override
    public void enqueue(Job job) {
        if (job.isDelayed(clock.instant())) {
            synchronized (scheduled) {
                scheduled.add(job);
            }
            return;
        }
        lanes.get(job.getLane()).add(job);
    }

    @Override
    public Optional<JobLease> poll(QueueLane lane) {
        Job job = lanes.get(lane).poll();
        return job == null ? Optional.empty() : Optional.of(new JobLease(job, null));
    }

    @Override
    public void ack(JobLease lease) {
        // 出队即移除，无需确认
    }

    @Override
    public void retry(JobLease lease, Job next) {
        enqueue(next);
    }

    @Override
    public void archive(JobLease lease, Job failed) {
        synchronized (dead) {
            if (dead.size() >= MAX_DEAD_JOBS) {
                Job dropped = dead.pollFirst();
                log.warn("Dead letter list full, dropping oldest job: id={}, type={}",
                        dropped.getId(), dropped.getType());
            }
            dead.addLast(failed);
        }
    }

    @Override
    public int promoteDueJobs(Instant now) {
        List<Job> due = new ArrayList<>();
        synchronized (scheduled) {
            while (!scheduled.isEmpty() && !scheduled.peek().isDelayed(now)) {
                due.add(scheduled.poll());
            }
        }
        for (Job job : due) {
            lanes.get(job.getLane()).add(job);
        }
        return due.size();
    }

    @Override
    public QueueStats stats() {
        Map<QueueLane, Long> pending = new EnumMap<>(QueueLane.class);
        lanes.forEach((lane, queue) -> pending.put(lane, (long) queue.size()));
        long scheduledCount;
        synchronized (scheduled) {
            scheduledCount = scheduled.size();
        }
        long deadCount;
        synchronized (dead) {
            deadCount = dead.size();
        }
        return QueueStats.builder()
                .pending(pending)
                .scheduled(scheduledCount)
                .dead(deadCount)
                .build();
    }

    /**
     * 当前死信快照。
     *
     * @return 死信任务列表
     */
    public List<Job> deadJobs() {
        synchronized (dead) {
            return new ArrayList<>(dead);
        }
    }
}
