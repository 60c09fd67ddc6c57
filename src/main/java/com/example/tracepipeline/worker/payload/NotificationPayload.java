package com.example.tracepipeline.worker.payload;

import com.example.tracepipeline.model.EventType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * notification:send 载荷
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPayload {
    private String webhookId;
    private EventType eventType;
    private Map<String, Object> data;
}
