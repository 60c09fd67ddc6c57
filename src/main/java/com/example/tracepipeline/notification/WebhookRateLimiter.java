package com.example.tracepipeline.notification;

/**
 * 每个 Webhook 每小时的投递配额。预留与计数在一次原子操作中完成，投递失败后归还。
 */
public interface WebhookRateLimiter {

    /**
     * 尝试预留一次投递配额。
     *
     * @param webhookId    Webhook ID
     * @param limitPerHour 每小时上限，null 或非正数表示不限
     * @return false 表示本小时配额已用完
     */
    boolean tryAcquire(String webhookId, Integer limitPerHour);

    /**
     * 归还 {@link #tryAcquire} 预留的配额。
     */
    void release(String webhookId);
}
