package com.example.tracepipeline.notification;

import com.example.tracepipeline.model.EventType;
import com.example.tracepipeline.model.Webhook;
import com.example.tracepipeline.model.WebhookDelivery;
import com.example.tracepipeline.queue.NonRetryableJobException;
import com.example.tracepipeline.repository.WebhookDeliveryRepository;
import com.example.tracepipeline.repository.WebhookRepository;
import com.example.tracepipeline.resilience.CircuitBreaker;
import com.example.tracepipeline.resilience.CircuitBreakerConfig;
import com.example.tracepipeline.resilience.CircuitBreakerOpenException;
import com.example.tracepipeline.resilience.CircuitBreakerRegistry;
import com.example.tracepipeline.resilience.CircuitState;
import com.example.tracepipeline.utils.UrlValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Webhook 投递：启用/订阅/限流检查，构建并签名请求体，经主机熔断器 POST，写投递审计。
 * 失败时抛出异常，由任务队列的重试预算重新投递。
 */
@Service
@Slf4j
public class NotificationDispatcher {

    static final Duration MAX_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String USER_AGENT = "TracePipeline-Webhook/1.0";
    private static final int MAX_RESPONSE_LENGTH = 4096;

    private final HttpClient httpClient;
    private final WebhookPayloadBuilder payloadBuilder;
    private final WebhookSigner signer;
    private final WebhookRateLimiter rateLimiter;
    private final UrlValidator urlValidator;
    private final CircuitBreakerRegistry breakerRegistry;
    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final Clock clock;

    public NotificationDispatcher(@Qualifier("webhookHttpClient") HttpClient httpClient,
                                  WebhookPayloadBuilder payloadBuilder,
                                  WebhookSigner signer,
                                  WebhookRateLimiter rateLimiter,
                                  UrlValidator urlValidator,
                                  CircuitBreakerRegistry breakerRegistry,
                                  WebhookRepository webhookRepository,
                                  WebhookDeliveryRepository deliveryRepository,
                                  Clock clock) {
        this.httpClient = httpClient;
        this.payloadBuilder = payloadBuilder;
        this.signer = signer;
        this.rateLimiter = rateLimiter;
        this.urlValidator = urlValidator;
        this.breakerRegistry = breakerRegistry;
        this.webhookRepository = webhookRepository;
        this.deliveryRepository = deliveryRepository;
        this.clock = clock;
    }

    /**
     * 投递一次通知。
     *
     * @param webhook    目标 Webhook
     * @param eventType  事件类型
     * @param data       事件数据
     * @param retryCount 当前任务的重试次数，写入审计记录
     * @param budget     剩余执行时间，null 表示不限
     * @return 投递记录；停用、未订阅或被限流时为空
     * @throws NonRetryableJobException  请求体无法构建或 URL 被 SSRF 规则拦截
     * @throws WebhookDeliveryException 网络错误、非 2xx 响应或熔断拒绝
     * @throws InterruptedException     线程被中断
     */
    public Optional<WebhookDelivery> send(Webhook webhook, EventType eventType, Map<String, Object> data,
                                          int retryCount, Duration budget) throws InterruptedException {
        if (!webhook.isEnabled()) {
            log.debug("Webhook {} is disabled, skipping {}", webhook.getId(), eventType.getValue());
            return Optional.empty();
        }
        if (!webhook.isSubscribedTo(eventType)) {
            log.debug("Webhook {} is not subscribed to {}", webhook.getId(), eventType.getValue());
            return Optional.empty();
        }

        boolean reserved = false;
        try {
            if (!rateLimiter.tryAcquire(webhook.getId(), webhook.getRateLimitPerHour())) {
                log.info("Rate limit exceeded for webhook {} ({} per hour)", webhook.getId(),
                        webhook.getRateLimitPerHour());
                return Optional.empty();
            }
            reserved = true;
        } catch (RuntimeException e) {
            // 限流存储不可用时不阻塞投递
            log.warn("Failed to check rate limit for webhook {}: {}", webhook.getId(), e.getMessage());
        }

        String payload;
        URI uri;
        try {
            payload = payloadBuilder.build(webhook.getType(), eventType, data);
            uri = urlValidator.validate(webhook.getUrl());
        } catch (JsonProcessingException e) {
            releaseQuietly(webhook, reserved);
            throw new NonRetryableJobException("Failed to build payload for webhook " + webhook.getId(), e);
        } catch (IllegalArgumentException e) {
            releaseQuietly(webhook, reserved);
            log.warn("Blocked webhook URL for {}: {}", webhook.getId(), e.getMessage());
            throw new NonRetryableJobException("Webhook URL rejected: " + e.getMessage(), e);
        }

        WebhookDelivery delivery = WebhookDelivery.builder()
                .webhookId(webhook.getId())
                .eventType(eventType)
                .payload(payload)
                .retryCount(retryCount)
                .build();

        HttpRequest request = buildRequest(webhook, uri, payload, requestTimeout(budget));
        String breakerName = breakerName(uri);
        CircuitBreaker breaker = breakerRegistry.get(breakerName, () -> webhookBreakerConfig(breakerName));
        AtomicReference<HttpResponse<String>> lastResponse = new AtomicReference<>();

        long start = clock.millis();
        try {
            breaker.execute(() -> {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                lastResponse.set(response);
                if (response.statusCode() < 200 || response.statusCode() >= 300) {
                    throw new WebhookDeliveryException("Webhook returned status " + response.statusCode(),
                            response.statusCode());
                }
                return response;
            });
        } catch (InterruptedException e) {
            releaseQuietly(webhook, reserved);
            throw e;
        } catch (Exception e) {
            delivery.setDurationMs(clock.millis() - start);
            applyResponse(delivery, lastResponse.get());
            delivery.setSuccess(false);
            delivery.setError(describe(e, lastResponse.get()));
            saveDelivery(delivery);
            releaseQuietly(webhook, reserved);
            log.warn("Webhook delivery failed: webhook={}, event={}, retry={}, error={}",
                    webhook.getId(), eventType.getValue(), retryCount, delivery.getError());
            throw new WebhookDeliveryException(delivery.getError(), e);
        }

        delivery.setDurationMs(clock.millis() - start);
        applyResponse(delivery, lastResponse.get());
        delivery.setSuccess(true);
        WebhookDelivery saved = saveDelivery(delivery);
        try {
            webhookRepository.updateLastTriggered(webhook.getId(), clock.instant());
        } catch (RuntimeException e) {
            log.warn("Failed to update last triggered time for webhook {}: {}", webhook.getId(), e.getMessage());
        }
        log.info("Webhook delivered: webhook={}, event={}, status={}, {}ms",
                webhook.getId(), eventType.getValue(), delivery.getStatusCode(), delivery.getDurationMs());
        return Optional.of(saved);
    }

    private HttpRequest buildRequest(Webhook webhook, URI uri, String payload, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT)
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        if (webhook.getHeaders() != null) {
            for (Map.Entry<String, String> header : webhook.getHeaders().entrySet()) {
                try {
                    builder.setHeader(header.getKey(), header.getValue());
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping restricted header '{}' for webhook {}", header.getKey(), webhook.getId());
                }
            }
        }

        if (webhook.getSecret() != null && !webhook.getSecret().isEmpty()) {
            builder.setHeader(WebhookSigner.SIGNATURE_HEADER, signer.sign(payload, webhook.getSecret()));
        }
        return builder.build();
    }

    static Duration requestTimeout(Duration budget) {
        if (budget == null || budget.compareTo(MAX_REQUEST_TIMEOUT) >= 0) {
            return MAX_REQUEST_TIMEOUT;
        }
        if (budget.isZero() || budget.isNegative()) {
            // 超时必须为正，截止时间已过时用最小值让请求立即失败
            return Duration.ofMillis(1);
        }
        return budget;
    }

    static String breakerName(URI uri) {
        return "webhook:" + uri.getHost() + (uri.getPort() != -1 ? ":" + uri.getPort() : "");
    }

    private static CircuitBreakerConfig webhookBreakerConfig(String name) {
        return CircuitBreakerConfig.builder()
                .name(name)
                .maxFailures(3)
                .timeout(Duration.ofSeconds(60))
                .maxHalfOpenRequests(1)
                .recordFailure(NotificationDispatcher::countsAgainstBreaker)
                .build();
    }

    /**
     * 主机熔断器只统计主机级故障：5xx、429、网络错误与超时。
     * 同一主机上多个租户共用熔断器，单个 Webhook 的 404/410 等只让本次投递失败。
     *
     * @param error call 抛出的异常
     * @return 是否计入失败
     */
    static boolean countsAgainstBreaker(Throwable error) {
        if (error instanceof WebhookDeliveryException) {
            return ((WebhookDeliveryException) error).isServerSide();
        }
        return !(error instanceof InterruptedException);
    }

    private static void applyResponse(WebhookDelivery delivery, HttpResponse<String> response) {
        if (response == null) {
            return;
        }
        delivery.setStatusCode(response.statusCode());
        String body = response.body();
        if (body != null && body.length() > MAX_RESPONSE_LENGTH) {
            body = body.substring(0, MAX_RESPONSE_LENGTH);
        }
        delivery.setResponse(body);
    }

    private static String describe(Exception e, HttpResponse<String> response) {
        if (e instanceof CircuitBreakerOpenException) {
            return ((CircuitBreakerOpenException) e).getState() == CircuitState.OPEN
                    ? "circuit breaker open: webhook endpoint temporarily unavailable"
                    : "circuit breaker half-open: too many concurrent requests";
        }
        if (response != null) {
            return "unexpected status code: " + response.statusCode();
        }
        return "request failed: " + e.getMessage();
    }

    private WebhookDelivery saveDelivery(WebhookDelivery delivery) {
        try {
            return deliveryRepository.save(delivery);
        } catch (RuntimeException e) {
            log.warn("Failed to record delivery for webhook {}: {}", delivery.getWebhookId(), e.getMessage());
            return delivery;
        }
    }

    private void releaseQuietly(Webhook webhook, boolean reserved) {
        if (!reserved) {
            return;
        }
        try {
            rateLimiter.release(webhook.getId());
        } catch (RuntimeException e) {
            log.warn("Failed to release rate limit reservation for webhook {}: {}", webhook.getId(), e.getMessage());
        }
    }
}
