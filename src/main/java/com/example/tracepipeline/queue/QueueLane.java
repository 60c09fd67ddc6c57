package com.example.tracepipeline.queue;

/**
 * 优先级队列通道。
 */
public enum QueueLane {
    CRITICAL("critical"),
    DEFAULT("default"),
    LOW("low");

    private final String key;

    QueueLane(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 根据名称解析通道（忽略大小写）。
     *
     * @param value 通道名
     * @return 通道
     * @throws IllegalArgumentException 未知通道
     */
    public static QueueLane fromKey(String value) {
        for (QueueLane lane : values()) {
            if (lane.key.equalsIgnoreCase(value)) {
                return lane;
            }
        }
        throw new IllegalArgumentException("Unknown queue lane: " + value);
    }
}
