package com.example.tracepipeline.queue;

import com.example.tracepipeline.support.StubJobHandler;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobHandlerRegistryTest {

    @Test
    void testEveryTypeResolvesToItsHandler() {
        JobHandlerRegistry registry = new JobHandlerRegistry(StubJobHandler.forAllTypes());

        for (JobType type : JobType.values()) {
            assertThat(registry.get(type).type()).isEqualTo(type);
        }
    }

    @Test
    void testMissingHandlerFailsStartup() {
        List<JobHandler> handlers = new ArrayList<>(StubJobHandler.forAllTypes());
        handlers.removeIf(handler -> handler.type() == JobType.DAILY_COST_REPORT);

        assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DAILY_COST_REPORT");
    }

    @Test
    void testDuplicateHandlerFailsStartup() {
        List<JobHandler> handlers = new ArrayList<>(StubJobHandler.forAllTypes());
        handlers.add(new StubJobHandler(JobType.EVALUATION));

        assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }
}
