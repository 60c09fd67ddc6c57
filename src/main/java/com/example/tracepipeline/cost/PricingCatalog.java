package com.example.tracepipeline.cost;

import com.example.tracepipeline.model.ModelPricing;
import com.example.tracepipeline.repository.ModelPricingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.Optional;

/**
 * 模型价格查询：项目自定义价格 → 全局精确匹配 → 全局前缀匹配（如 gpt-4o-2024-08-06 匹配 gpt-4o）。
 */
@Component
@RequiredArgsConstructor
public class PricingCatalog {

    static final int COST_SCALE = 10;
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final ModelPricingRepository pricingRepository;

    public Optional<ModelPricing> find(String projectId, String model) {
        if (model == null || model.isEmpty()) {
            return Optional.empty();
        }
        if (projectId != null) {
            Optional<ModelPricing> projectPricing = pricingRepository.findFirstByProjectIdAndModel(projectId, model);
            if (projectPricing.isPresent()) {
                return projectPricing;
            }
        }
        Optional<ModelPricing> exact = pricingRepository.findFirstByProjectIdIsNullAndModel(model);
        if (exact.isPresent()) {
            return exact;
        }
        // 最长前缀优先，避免 gpt-4 抢先匹配 gpt-4o-mini
        return pricingRepository.findByProjectIdIsNull().stream()
                .filter(pricing -> model.startsWith(pricing.getModel()))
                .max(Comparator.comparingInt(pricing -> pricing.getModel().length()));
    }

    /**
     * 成本 = tokens × 每千 token 单价 / 1000。
     */
    public static CostBreakdown price(ModelPricing pricing, long inputTokens, long outputTokens) {
        BigDecimal inputCost = BigDecimal.valueOf(inputTokens).multiply(pricing.getInputPricePer1k())
                .divide(THOUSAND, COST_SCALE, RoundingMode.HALF_UP);
        BigDecimal outputCost = BigDecimal.valueOf(outputTokens).multiply(pricing.getOutputPricePer1k())
                .divide(THOUSAND, COST_SCALE, RoundingMode.HALF_UP);
        return new CostBreakdown(inputCost, outputCost, inputCost.add(outputCost));
    }
}
