package com.example.tracepipeline.evaluation.rule;

import com.example.tracepipeline.model.Observation;
import com.example.tracepipeline.model.Trace;

/**
 * 规则检查的内容来源。
 */
public enum RuleTarget {
    TRACE_INPUT("trace_input"),
    TRACE_OUTPUT("trace_output"),
    OBSERVATION_INPUT("observation_input"),
    OBSERVATION_OUTPUT("observation_output");

    private final String key;

    RuleTarget(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 取出目标内容，缺失时返回空字符串。
     *
     * @param trace       trace
     * @param observation 观测，可为 null
     * @return 内容
     */
    public String resolve(Trace trace, Observation observation) {
        String content = null;
        switch (this) {
            case TRACE_INPUT:
                content = trace != null ? trace.getInput() : null;
                break;
            case TRACE_OUTPUT:
                content = trace != null ? trace.getOutput() : null;
                break;
            case OBSERVATION_INPUT:
                content = observation != null ? observation.getInput() : null;
                break;
            case OBSERVATION_OUTPUT:
                content = observation != null ? observation.getOutput() : null;
                break;
            default:
                break;
        }
        return content != null ? content : "";
    }

    public static RuleTarget fromKey(String key) {
        for (RuleTarget target : values()) {
            if (target.key.equals(key)) {
                return target;
            }
        }
        return null;
    }
}
