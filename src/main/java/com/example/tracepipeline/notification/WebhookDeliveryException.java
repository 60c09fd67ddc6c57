package com.example.tracepipeline.notification;

/**
 * 投递失败（非 2xx、网络错误、熔断拒绝），由任务队列按重试预算重新投递。
 */
public class WebhookDeliveryException extends RuntimeException {

    // 非 2xx 响应的状态码；网络错误或熔断拒绝时为 null
    private final Integer statusCode;

    public WebhookDeliveryException(String message) {
        this(message, (Integer) null);
    }

    public WebhookDeliveryException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public WebhookDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * 是否为接收端服务故障：5xx 或 429。其余 4xx 属于单个 Webhook 自身的配置问题。
     */
    public boolean isServerSide() {
        return statusCode != null && (statusCode >= 500 || statusCode == 429);
    }
}
