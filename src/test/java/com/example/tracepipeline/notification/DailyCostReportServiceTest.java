package com.example.tracepipeline.notification;

import com.example.tracepipeline.cost.CostAttributionService;
import com.example.tracepipeline.cost.DailyCostSummary;
import com.example.tracepipeline.cost.ModelCostTotal;
import com.example.tracepipeline.cost.ProjectCostSummary;
import com.example.tracepipeline.model.EventType;
import com.example.tracepipeline.model.Webhook;
import com.example.tracepipeline.queue.JobClient;
import com.example.tracepipeline.queue.JobType;
import com.example.tracepipeline.repository.WebhookRepository;
import com.example.tracepipeline.worker.payload.NotificationPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DailyCostReportServiceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 14);

    @Mock
    private CostAttributionService costAttributionService;
    @Mock
    private WebhookRepository webhookRepository;
    @Mock
    private JobClient jobClient;

    private DailyCostReportService service;

    @BeforeEach
    void setUp() {
        service = new DailyCostReportService(costAttributionService, webhookRepository, jobClient);
    }

    private static ProjectCostSummary summary(String projectId, int models) {
        List<ModelCostTotal> totals = new ArrayList<>();
        for (int i = 0; i < models; i++) {
            totals.add(new ModelCostTotal("model-" + i, BigDecimal.valueOf(10 - i), 3, 100, 50));
        }
        return ProjectCostSummary.builder()
                .projectId(projectId)
                .totalCost(new BigDecimal("12.34"))
                .observationCount(3L * models)
                .traceCount(4)
                .models(totals)
                .build();
    }

    @Test
    void testReportsForAllSubscribedProjects() {
        when(webhookRepository.findProjectIdsWithEnabledEvent(EventType.DAILY_COST_REPORT))
                .thenReturn(List.of("p1", "p2"));
        when(costAttributionService.aggregateDaily(null, DATE))
                .thenReturn(new DailyCostSummary(DATE, List.of(summary("p1", 2))));
        when(webhookRepository.findEnabledByProjectAndEvent("p1", EventType.DAILY_COST_REPORT))
                .thenReturn(List.of(Webhook.builder().id("a").build(), Webhook.builder().id("b").build()));
        when(webhookRepository.findEnabledByProjectAndEvent("p2", EventType.DAILY_COST_REPORT))
                .thenReturn(List.of(Webhook.builder().id("c").build()));

        assertThat(service.sendReports(null, DATE)).isEqualTo(3);

        ArgumentCaptor<Object> payloads = ArgumentCaptor.forClass(Object.class);
        verify(jobClient, times(3)).enqueue(eq(JobType.NOTIFICATION_SEND), payloads.capture());
        NotificationPayload quiet = (NotificationPayload) payloads.getAllValues().get(2);
        assertThat(quiet.getWebhookId()).isEqualTo("c");
        assertThat(quiet.getData())
                .containsEntry("projectId", "p2")
                .containsEntry("traceCount", 0L)
                .containsEntry("totalCost", BigDecimal.ZERO);
    }

    @Test
    void testSingleProject() {
        when(costAttributionService.aggregateDaily("p1", DATE))
                .thenReturn(new DailyCostSummary(DATE, List.of(summary("p1", 1))));
        when(webhookRepository.findEnabledByProjectAndEvent("p1", EventType.DAILY_COST_REPORT))
                .thenReturn(List.of(Webhook.builder().id("a").build()));

        assertThat(service.sendReports("p1", DATE)).isEqualTo(1);
    }

    @Test
    void testEnqueueFailureSkipsOnlyThatWebhook() {
        when(costAttributionService.aggregateDaily("p1", DATE))
                .thenReturn(new DailyCostSummary(DATE, List.of(summary("p1", 1))));
        when(webhookRepository.findEnabledByProjectAndEvent("p1", EventType.DAILY_COST_REPORT))
                .thenReturn(List.of(Webhook.builder().id("a").build(), Webhook.builder().id("b").build()));
        when(jobClient.enqueue(eq(JobType.NOTIFICATION_SEND), any()))
                .thenThrow(new IllegalStateException("redis down"))
                .thenReturn(null);

        assertThat(service.sendReports("p1", DATE)).isEqualTo(1);
        verify(jobClient, times(2)).enqueue(eq(JobType.NOTIFICATION_SEND), any());
    }

    @Test
    void testNoSubscribers() {
        when(webhookRepository.findProjectIdsWithEnabledEvent(EventType.DAILY_COST_REPORT)).thenReturn(List.of());

        assertThat(service.sendReports(null, DATE)).isZero();
        verifyNoInteractions(costAttributionService, jobClient);
    }

    @Test
    void testReportDataKeepsTopFiveModels() {
        Map<String, Object> data = DailyCostReportService.reportData(summary("p1", 7), DATE);

        assertThat(data)
                .containsEntry("date", "2024-03-14")
                .containsEntry("totalCost", new BigDecimal("12.34"))
                .containsEntry("traceCount", 4L)
                .containsEntry("observationCount", 21L);
        List<?> topModels = (List<?>) data.get("topModels");
        assertThat(topModels).hasSize(DailyCostReportService.TOP_MODELS);
        assertThat(topModels.get(0)).isEqualTo(Map.of("model", "model-0", "cost", BigDecimal.valueOf(10), "count", 3L));
    }
}
