package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.model.Observation;
import com.example.tracepipeline.model.Trace;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptTemplateRendererTest {

    private final PromptTemplateRenderer renderer = new PromptTemplateRenderer();

    @Test
    void testRenderTraceAndObservationVariables() {
        Trace trace = Trace.builder().id("t1").name("qa").input("What is 2+2?").output("4").build();
        Observation observation = Observation.builder().id("o1").name("llm-call").type("GENERATION")
                .model("gpt-4o").input("prompt").output("completion").build();

        String prompt = renderer.render(
                "Q: {{trace_input}} A: {{trace_output}} [{{trace_id}}/{{observation_name}}/{{model}}] {{output}}",
                renderer.variables(trace, observation));

        assertThat(prompt).isEqualTo("Q: What is 2+2? A: 4 [t1/llm-call/gpt-4o] completion");
    }

    @Test
    void testEmptyContentLeavesPlaceholder() {
        Trace trace = Trace.builder().id("t1").name("qa").input("").build();

        Map<String, String> variables = renderer.variables(trace, null);

        assertThat(variables).containsOnlyKeys("trace_id", "trace_name");
        assertThat(renderer.render("Input: {{trace_input}}", variables)).isEqualTo("Input: {{trace_input}}");
    }
}
