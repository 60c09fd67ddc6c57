package com.example.tracepipeline.controller;

import com.example.tracepipeline.queue.JobBroker;
import com.example.tracepipeline.queue.JobServer;
import com.example.tracepipeline.queue.QueueLane;
import com.example.tracepipeline.queue.QueueStats;
import com.example.tracepipeline.resilience.CircuitBreakerRegistry;
import com.example.tracepipeline.resilience.CircuitBreakerStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 监控数据 API
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringApiController {

    private final JobBroker jobBroker;
    private final CircuitBreakerRegistry breakerRegistry;
    private final MeterRegistry meterRegistry;

    /**
     * 各通道待处理数、延迟任务数与死信数
     */
    @GetMapping("/queues")
    public Map<String, Object> getQueues() {
        QueueStats stats = jobBroker.stats();
        Map<String, Object> lanes = new LinkedHashMap<>();
        for (QueueLane lane : QueueLane.values()) {
            lanes.put(lane.getKey(), stats.getPending().getOrDefault(lane, 0L));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("lanes", lanes);
        result.put("scheduled", stats.getScheduled());
        result.put("dead", stats.getDead());
        return result;
    }

    @GetMapping("/circuit-breakers")
    public List<CircuitBreakerStats> getCircuitBreakers() {
        return breakerRegistry.stats();
    }

    /**
     * 按任务类型统计执行结果：{type: {succeeded, retried, archived}}
     */
    @GetMapping("/jobs")
    public Map<String, Map<String, Long>> getJobOutcomes() {
        Map<String, Map<String, Long>> outcomes = new TreeMap<>();
        List<Counter> counters = new ArrayList<>(meterRegistry.find(JobServer.METRIC_NAME).counters());
        for (Counter counter : counters) {
            String type = counter.getId().getTag("type");
            String outcome = counter.getId().getTag("outcome");
            if (type == null || outcome == null) {
                continue;
            }
            outcomes.computeIfAbsent(type, key -> new TreeMap<>())
                    .merge(outcome, (long) counter.count(), Long::sum);
        }
        return outcomes;
    }
}
