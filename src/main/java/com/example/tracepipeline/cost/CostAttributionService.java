package com.example.tracepipeline.cost;

import com.example.tracepipeline.model.ModelPricing;
import com.example.tracepipeline.model.Observation;
import com.example.tracepipeline.queue.NonRetryableJobException;
import com.example.tracepipeline.repository.ModelCostRow;
import com.example.tracepipeline.repository.ObservationRepository;
import com.example.tracepipeline.repository.ProjectTraceCount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 成本计算：单条观测、整条 trace 批量补算、按天聚合。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CostAttributionService {

    private final PricingCatalog pricingCatalog;
    private final ObservationRepository observationRepository;

    /**
     * 为单条观测计算并写回成本。没有价格的模型直接跳过。
     *
     * @return 计算结果；没有价格时为 empty
     * @throws NonRetryableJobException token 数为负
     * @throws IllegalStateException    观测尚未写入，可重试
     */
    public Optional<CostBreakdown> calculate(String projectId, String traceId, String observationId, String model,
                                             long promptTokens, long completionTokens) {
        if (promptTokens < 0 || completionTokens < 0) {
            throw new NonRetryableJobException("token counts must not be negative");
        }

        Optional<ModelPricing> pricing = pricingCatalog.find(projectId, model);
        if (pricing.isEmpty()) {
            log.debug("No pricing available for model {}", model);
            return Optional.empty();
        }

        CostBreakdown cost = PricingCatalog.price(pricing.get(), promptTokens, completionTokens);
        int updated = observationRepository.updateCosts(projectId, observationId,
                cost.getInputCost(), cost.getOutputCost(), cost.getTotalCost());
        if (updated == 0) {
            throw new IllegalStateException("observation not found: " + observationId + " (trace " + traceId + ")");
        }

        log.info("Cost calculation completed: observationId={}, inputCost={}, outputCost={}, totalCost={}",
                observationId, cost.getInputCost(), cost.getOutputCost(), cost.getTotalCost());
        return Optional.of(cost);
    }

    /**
     * 补算一条 trace 下所有观测的成本。已计价、缺少模型或 token、没有价格的观测计为跳过，单条失败不影响其他观测。
     */
    public CostBatchResult calculateBatch(String projectId, String traceId) {
        List<Observation> observations = observationRepository.findByProjectIdAndTraceId(projectId, traceId);

        int processed = 0;
        int skipped = 0;
        int failed = 0;
        for (Observation observation : observations) {
            long inputTokens = nullToZero(observation.getInputTokens());
            long outputTokens = nullToZero(observation.getOutputTokens());
            if (observation.isPriced()
                    || observation.getModel() == null || observation.getModel().isEmpty()
                    || (inputTokens == 0 && outputTokens == 0)) {
                skipped++;
                continue;
            }

            try {
                Optional<ModelPricing> pricing = pricingCatalog.find(projectId, observation.getModel());
                if (pricing.isEmpty()) {
                    skipped++;
                    continue;
                }
                CostBreakdown cost = PricingCatalog.price(pricing.get(), inputTokens, outputTokens);
                observationRepository.updateCosts(projectId, observation.getId(),
                        cost.getInputCost(), cost.getOutputCost(), cost.getTotalCost());
                processed++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Failed to calculate cost for observation {} (model {}): {}",
                        observation.getId(), observation.getModel(), e.getMessage());
            }
        }

        log.info("Batch cost calculation completed: traceId={}, processed={}, skipped={}, failed={}, total={}",
                traceId, processed, skipped, failed, observations.size());
        return new CostBatchResult(observations.size(), processed, skipped, failed);
    }

    /**
     * 汇总某天（UTC）已计价观测的成本，只读。
     *
     * @param projectId 项目 ID，null 表示所有项目
     * @param date      日期
     * @return 按项目、模型的汇总
     */
    public DailyCostSummary aggregateDaily(String projectId, LocalDate date) {
        Instant from = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        Map<String, List<ModelCostTotal>> modelsByProject = new TreeMap<>();
        for (ModelCostRow row : observationRepository.aggregateCosts(projectId, from, to)) {
            modelsByProject.computeIfAbsent(row.getProjectId(), key -> new ArrayList<>())
                    .add(new ModelCostTotal(row.getModel(),
                            row.getTotalCost() != null ? row.getTotalCost() : BigDecimal.ZERO,
                            row.getObservationCount(),
                            nullToZero(row.getInputTokens()),
                            nullToZero(row.getOutputTokens())));
        }

        Map<String, Long> traceCounts = new HashMap<>();
        for (ProjectTraceCount count : observationRepository.countTraces(projectId, from, to)) {
            traceCounts.put(count.getProjectId(), count.getTraceCount());
        }

        List<ProjectCostSummary> projects = new ArrayList<>();
        modelsByProject.forEach((project, models) -> {
            models.sort(Comparator.comparing(ModelCostTotal::getCost).reversed());
            BigDecimal total = BigDecimal.ZERO;
            long observationCount = 0;
            for (ModelCostTotal model : models) {
                total = total.add(model.getCost());
                observationCount += model.getObservationCount();
            }
            projects.add(ProjectCostSummary.builder()
                    .projectId(project)
                    .totalCost(total)
                    .observationCount(observationCount)
                    .traceCount(traceCounts.getOrDefault(project, 0L))
                    .models(models)
                    .build());
            log.info("Daily aggregation: projectId={}, date={}, totalCost={}, observations={}, models={}",
                    project, date, total, observationCount, models.size());
        });

        return new DailyCostSummary(date, projects);
    }

    private static long nullToZero(Long value) {
        return value != null ? value : 0L;
    }
}
