package com.example.tracepipeline.controller;

import com.example.tracepipeline.queue.Job;
import com.example.tracepipeline.queue.JobClient;
import com.example.tracepipeline.queue.JobOptions;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.queue.QueueLane;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 生产者入口：将任务提交到队列。
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final JobClient jobClient;

    @PostMapping
    public ResponseEntity<Map<String, Object>> enqueue(@RequestBody JobRequest request) {
        if (request.getType() == null || request.getType().isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        JobType type = JobType.fromWireName(request.getType());

        JobOptions options = JobOptions.builder()
                .lane(request.getQueue() != null ? QueueLane.fromKey(request.getQueue()) : null)
                .maxRetries(request.getMaxRetries())
                .timeout(request.getTimeoutSeconds() != null ? Duration.ofSeconds(request.getTimeoutSeconds()) : null)
                .delay(request.getDelaySeconds() != null ? Duration.ofSeconds(request.getDelaySeconds()) : null)
                .build();

        Object payload = request.getPayload() != null ? request.getPayload() : JsonNodeFactory.instance.objectNode();
        Job job = jobClient.enqueue(type, payload, options);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", job.getId());
        body.put("type", type.getWireName());
        body.put("queue", job.getLane().getKey());
        body.put("processAt", job.getProcessAt());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }
}
