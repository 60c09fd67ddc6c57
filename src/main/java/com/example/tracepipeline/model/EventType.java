package com.example.tracepipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 可触发通知的事件类型。
 */
public enum EventType {
    TRACE_ERROR("trace.error"),
    TRACE_COST_THRESHOLD("trace.cost_threshold"),
    TRACE_LATENCY_THRESHOLD("trace.latency_threshold"),
    DAILY_COST_REPORT("daily.cost_report"),
    EVAL_FAILED("eval.failed"),
    EVAL_SCORE_LOW("eval.score_low"),
    ANOMALY_DETECTED("anomaly.detected");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EventType fromValue(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
