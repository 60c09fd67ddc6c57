package com.example.tracepipeline.queue;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class QueueStats {

    Map<QueueLane, Long> pending;

    long scheduled;

    long dead;
}
