package com.example.tracepipeline.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 任务类型到处理器的注册表。
 * 启动时校验完整性：任何类型缺少处理器或重复注册都会使应用启动失败。
 */
@Component
@Slf4j
public class JobHandlerRegistry {

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    public JobHandlerRegistry(List<JobHandler> handlerBeans) {
        for (JobHandler handler : handlerBeans) {
            JobHandler existing = handlers.putIfAbsent(handler.type(), handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate handlers for " + handler.type() + ": "
                        + existing.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }

        Set<JobType> missing = EnumSet.allOf(JobType.class);
        missing.removeAll(handlers.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for job types: " + missing);
        }
        log.info("Registered {} job handlers", handlers.size());
    }

    public JobHandler get(JobType type) {
        return handlers.get(type);
    }
}
