package com.example.tracepipeline.evaluation;

import lombok.Getter;

/**
 * LLM 接口调用失败。serverSide 为 true（5xx、429、供应商错误体）时计入熔断器；
 * 其余 4xx 属于请求本身的问题，不计入熔断器也不重试。
 */
@Getter
public class LlmApiException extends Exception {

    private final int statusCode;
    private final boolean serverSide;

    public LlmApiException(String message, int statusCode, boolean serverSide) {
        super(message);
        this.statusCode = statusCode;
        this.serverSide = serverSide;
    }

    public LlmApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.serverSide = true;
    }
}
