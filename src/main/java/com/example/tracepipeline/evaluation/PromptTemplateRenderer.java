package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.model.Observation;
import com.example.tracepipeline.model.Trace;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将 trace / observation 字段代入 {{variable}} 占位符。未知占位符原样保留。
 */
@Component
public class PromptTemplateRenderer {

    /**
     * 提取可用变量。输入、输出与模型只在非空时提供，对应占位符否则保持原样。
     *
     * @param trace       trace
     * @param observation 观测，可为 null
     * @return 变量表
     */
    public Map<String, String> variables(Trace trace, Observation observation) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (trace != null) {
            variables.put("trace_id", nullToEmpty(trace.getId()));
            variables.put("trace_name", nullToEmpty(trace.getName()));
            putIfNotEmpty(variables, "trace_input", trace.getInput());
            putIfNotEmpty(variables, "trace_output", trace.getOutput());
        }
        if (observation != null) {
            variables.put("observation_id", nullToEmpty(observation.getId()));
            variables.put("observation_name", nullToEmpty(observation.getName()));
            variables.put("observation_type", nullToEmpty(observation.getType()));
            putIfNotEmpty(variables, "input", observation.getInput());
            putIfNotEmpty(variables, "output", observation.getOutput());
            putIfNotEmpty(variables, "model", observation.getModel());
        }
        return variables;
    }

    public String render(String template, Map<String, String> variables) {
        String prompt = template;
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            prompt = prompt.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        return prompt;
    }

    private static void putIfNotEmpty(Map<String, String> variables, String key, String value) {
        if (value != null && !value.isEmpty()) {
            variables.put(key, value);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
