package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.queue.NonRetryableJobException;

/**
 * 评估器配置错误（缺少模板、规则配置非法、未配置 API Key 等），重试无意义。
 */
public class EvaluatorConfigException extends NonRetryableJobException {

    public EvaluatorConfigException(String message) {
        super(message);
    }

    public EvaluatorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
