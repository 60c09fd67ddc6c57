package com.example.tracepipeline.controller;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * POST /api/jobs 请求体
 */
@Data
public class JobRequest {
    private String type;         // 线上名称，如 "eval:run"
    private JsonNode payload;
    private String queue;        // critical / default / low
    private Integer maxRetries;
    private Long timeoutSeconds;
    private Long delaySeconds;
}
