package com.example.tracepipeline.worker;

import com.example.tracepipeline.model.Webhook;
import com.example.tracepipeline.notification.NotificationDispatcher;
import com.example.tracepipeline.queue.JobContext;
import com.example.tracepipeline.queue.JobHandler;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.queue.NonRetryableJobException;
import com.example.tracepipeline.repository.WebhookRepository;
import com.example.tracepipeline.worker.payload.NotificationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationSendHandler implements JobHandler {

    private final WebhookRepository webhookRepository;
    private final NotificationDispatcher dispatcher;

    @Override
    public JobType type() {
        return JobType.NOTIFICATION_SEND;
    }

    @Override
    public void handle(JobContext context) throws InterruptedException {
        NotificationPayload payload = context.payloadAs(NotificationPayload.class);
        String webhookId = PayloadFields.required(payload.getWebhookId(), "webhookId");
        if (payload.getEventType() == null) {
            throw new NonRetryableJobException("eventType is required");
        }

        Webhook webhook = webhookRepository.findById(webhookId)
                .orElseThrow(() -> new NonRetryableJobException("webhook not found: " + webhookId));

        dispatcher.send(webhook, payload.getEventType(), payload.getData(), context.getRetryCount(),
                context.remaining());
    }
}
