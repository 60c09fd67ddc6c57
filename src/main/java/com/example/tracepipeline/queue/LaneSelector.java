package com.example.tracepipeline.queue;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 按权重决定每次拉取时的通道顺序（加权随机、无放回抽样）。
 * 高权重通道更常排在前面，低权重通道也总有机会被优先拉取。
 */
public class LaneSelector {

    private final Map<QueueLane, Integer> weights;
    private final Random random;

    public LaneSelector(Map<QueueLane, Integer> weights, Random random) {
        for (QueueLane lane : QueueLane.values()) {
            Integer weight = weights.get(lane);
            if (weight == null || weight <= 0) {
                throw new IllegalArgumentException("Lane " + lane.getKey() + " needs a positive weight");
            }
        }
        this.weights = new EnumMap<>(weights);
        this.random = random;
    }

    public static LaneSelector fromProperties(QueueProperties properties) {
        Map<QueueLane, Integer> weights = new EnumMap<>(QueueLane.class);
        weights.put(QueueLane.CRITICAL, properties.getCriticalWeight());
        weights.put(QueueLane.DEFAULT, properties.getDefaultWeight());
        weights.put(QueueLane.LOW, properties.getLowWeight());
        return new LaneSelector(weights, new Random());
    }

    /**
     * @return 本次拉取的通道顺序，包含全部通道
     */
    public List<QueueLane> order() {
        List<QueueLane> remaining = new ArrayList<>(weights.keySet());
        List<QueueLane> ordered = new ArrayList<>(remaining.size());
        while (!remaining.isEmpty()) {
            int total = 0;
            for (QueueLane lane : remaining) {
                total += weights.get(lane);
            }
            int pick = random.nextInt(total);
            for (int i = 0; i < remaining.size(); i++) {
                pick -= weights.get(remaining.get(i));
                if (pick < 0) {
                    ordered.add(remaining.remove(i));
                    break;
                }
            }
        }
        return ordered;
    }
}
