package com.example.tracepipeline.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 工作线程池：按通道权重拉取任务，在超时约束下执行处理器，并根据结果确认、重试或归档。
 */
@Component
@Slf4j
public class JobServer implements SmartLifecycle {

    public static final String METRIC_NAME = "pipeline.jobs";

    private final JobBroker broker;
    private final JobHandlerRegistry registry;
    private final JobErrorHandler errorHandler;
    private final QueueProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final LaneSelector laneSelector;
    private final RetryBackoff backoff;

    private volatile ExecutorService handlerExecutor = Executors.newCachedThreadPool(namedThreads("job-handler-"));
    private volatile ExecutorService workers;
    private volatile boolean running;

    public JobServer(JobBroker broker, JobHandlerRegistry registry, JobErrorHandler errorHandler,
                     QueueProperties properties, ObjectMapper objectMapper, Clock clock,
                     MeterRegistry meterRegistry) {
        this.broker = broker;
        this.registry = registry;
        this.errorHandler = errorHandler;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.laneSelector = LaneSelector.fromProperties(properties);
        this.backoff = new RetryBackoff(properties.getRetryInitialDelay(), properties.getRetryMultiplier(),
                properties.getRetryMaxDelay());
    }

    @Override
    public void start() {
        start(properties.getConcurrency());
    }

    /**
     * 启动 n 个工作线程。
     *
     * @param concurrency 工作线程数
     */
    public synchronized void start(int concurrency) {
        if (running) {
            return;
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        running = true;
        if (handlerExecutor.isShutdown()) {
            handlerExecutor = Executors.newCachedThreadPool(namedThreads("job-handler-"));
        }
        workers = Executors.newFixedThreadPool(concurrency, namedThreads("job-worker-"));
        for (int i = 0; i < concurrency; i++) {
            workers.submit(this::workLoop);
        }
        log.info("Job server started with {} workers", concurrency);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        workers.shutdownNow();
        handlerExecutor.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Job workers did not terminate within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Job server stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStartup();
    }

    private void workLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<JobLease> lease = nextLease();
                if (lease.isPresent()) {
                    process(lease.get());
                } else {
                    Thread.sleep(properties.getPollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                // broker 不可用时退避后继续
                log.error("Job worker loop error: {}", e.getMessage(), e);
                sleepQuietly(properties.getPollInterval().multipliedBy(10));
            }
        }
    }

    Optional<JobLease> nextLease() {
        for (QueueLane lane : laneSelector.order()) {
            Optional<JobLease> lease = broker.poll(lane);
            if (lease.isPresent()) {
                return lease;
            }
        }
        return Optional.empty();
    }

    /**
     * 执行一个已领取的任务，并在返回前完成确认、重试或归档。
     *
     * @param lease 任务租约
     * @throws InterruptedException 工作线程在等待处理器时被中断，任务原样放回
     */
    public void process(JobLease lease) throws InterruptedException {
        Job job = lease.getJob();
        JobHandler handler = registry.get(job.getType());
        Duration timeout = job.getTimeout() != null ? job.getTimeout() : job.getType().getDefaultTimeout();
        Instant started = clock.instant();
        JobContext context = new JobContext(job, started.plus(timeout), clock, objectMapper);

        Future<?> future = handlerExecutor.submit(() -> {
            handler.handle(context);
            return null;
        });

        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            broker.ack(lease);
            record(job, "succeeded");
            log.debug("Job completed: id={}, type={}", job.getId(), job.getType().getWireName());
        } catch (TimeoutException e) {
            future.cancel(true);
            fail(lease, new JobTimeoutException(job, timeout));
        } catch (ExecutionException e) {
            fail(lease, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            broker.retry(lease, job);
            throw e;
        }
    }

    private void fail(JobLease lease, Throwable cause) {
        Job job = lease.getJob();
        String error = cause.getClass().getSimpleName() + ": " + cause.getMessage();

        if (cause instanceof NonRetryableJobException || job.isRetryExhausted()) {
            Job failed = job.toBuilder().lastError(error).build();
            broker.archive(lease, failed);
            record(job, "archived");
            errorHandler.handleError(failed, cause, true);
            return;
        }

        Duration delay = backoff.delayFor(job.getRetried());
        Job next = job.toBuilder()
                .retried(job.getRetried() + 1)
                .lastError(error)
                .processAt(clock.instant().plus(delay))
                .build();
        broker.retry(lease, next);
        record(job, "retried");
        errorHandler.handleError(next, cause, false);
    }

    private void record(Job job, String outcome) {
        meterRegistry.counter(METRIC_NAME, "type", job.getType().getWireName(), "outcome", outcome).increment();
    }

    private static void sleepQuietly(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
