package com.example.tracepipeline.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 兼容的 chat completion 接口客户端。
 */
@Slf4j
public class ChatCompletionClient {

    private static final Configuration LENIENT = Configuration.defaultConfiguration()
            .addOptions(Option.SUPPRESS_EXCEPTIONS);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public ChatCompletionClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String apiKey,
                                Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * 发送一次 JSON 模式的对话请求。
     *
     * @param model        模型名
     * @param systemPrompt 系统提示词
     * @param userPrompt   用户提示词
     * @param budget       剩余时间预算，与请求超时取较小值
     * @return 第一条回复内容
     * @throws LlmApiException      接口返回错误
     * @throws IOException          网络错误或超时
     * @throws InterruptedException 任务被取消
     */
    public String complete(String model, String systemPrompt, String userPrompt, Duration budget)
            throws LlmApiException, IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)));
        body.put("temperature", 0.1);
        body.put("max_tokens", 500);
        body.put("response_format", Map.of("type", "json_object"));

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chat completion request", e);
        }

        Duration timeout = budget != null && budget.compareTo(requestTimeout) < 0 ? budget : requestTimeout;
        if (timeout.isZero() || timeout.isNegative()) {
            throw new HttpTimeoutException("No time left for LLM call");
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status >= 500 || status == 429) {
            throw new LlmApiException("API error (status " + status + "): " + response.body(), status, true);
        }
        if (status != 200) {
            throw new LlmApiException("API client error (status " + status + "): " + response.body(), status, false);
        }

        DocumentContext document;
        try {
            document = JsonPath.using(LENIENT).parse(response.body());
        } catch (InvalidJsonException e) {
            throw new LlmApiException("failed to parse response", e);
        }

        Object error = document.read("$.error");
        if (error != null) {
            String message = document.read("$.error.message", String.class);
            throw new LlmApiException("LLM API error: " + (message != null ? message : error), status, true);
        }

        String content = document.read("$.choices[0].message.content", String.class);
        if (content == null) {
            throw new LlmApiException("no response from LLM", status, true);
        }
        log.debug("LLM call completed: model={}, responseLength={}", model, content.length());
        return content;
    }
}
