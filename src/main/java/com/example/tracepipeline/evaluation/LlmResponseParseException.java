package com.example.tracepipeline.evaluation;

/**
 * LLM 返回内容无法解析。模型输出有随机性，按可重试处理。
 */
public class LlmResponseParseException extends RuntimeException {

    public LlmResponseParseException(String message) {
        super(message);
    }

    public LlmResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
