package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.evaluation.rule.RuleConfigParser;
import com.example.tracepipeline.evaluation.rule.RuleDefinition;
import com.example.tracepipeline.evaluation.rule.RuleOutcome;
import com.example.tracepipeline.model.Evaluator;
import com.example.tracepipeline.model.Observation;
import com.example.tracepipeline.model.Score;
import com.example.tracepipeline.model.ScoreDataType;
import com.example.tracepipeline.model.ScoreSource;
import com.example.tracepipeline.model.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 规则评估，结果总是 BOOLEAN 分数（1.0 / 0.0）。
 */
@Component
@RequiredArgsConstructor
public class RuleEvaluator {

    private final RuleConfigParser parser;

    public Score evaluate(Evaluator evaluator, Trace trace, Observation observation) {
        RuleDefinition rule = parser.parse(evaluator.getConfig());
        RuleOutcome outcome = rule.evaluate(rule.getTarget().resolve(trace, observation));

        return Score.builder()
                .projectId(evaluator.getProjectId())
                .traceId(trace.getId())
                .observationId(observation != null ? observation.getId() : null)
                .name(evaluator.getScoreName())
                .value(outcome.isPassed() ? 1.0 : 0.0)
                .dataType(ScoreDataType.BOOLEAN)
                .source(ScoreSource.EVAL)
                .comment(outcome.getComment())
                .configId(evaluator.getId())
                .build();
    }
}
