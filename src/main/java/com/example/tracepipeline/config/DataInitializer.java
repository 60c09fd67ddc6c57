package com.example.tracepipeline.config;

import com.example.tracepipeline.model.ModelPricing;
import com.example.tracepipeline.repository.ModelPricingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * 启动时写入全局默认价格（每 1k token，USD）。已有全局价格时不覆盖。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final ModelPricingRepository pricingRepository;

    @Value("${app.pricing.seed-defaults:true}")
    private boolean seedDefaults;

    @Override
    public void run(String... args) {
        if (!seedDefaults) {
            return;
        }
        if (!pricingRepository.findByProjectIdIsNull().isEmpty()) {
            log.info("Global model pricing already present, skipping seed");
            return;
        }

        List<ModelPricing> defaults = List.of(
                price("openai", "gpt-4o", "0.0025", "0.01"),
                price("openai", "gpt-4o-mini", "0.00015", "0.0006"),
                price("openai", "gpt-4-turbo", "0.01", "0.03"),
                price("openai", "gpt-3.5-turbo", "0.0005", "0.0015"),
                price("anthropic", "claude-3-5-sonnet", "0.003", "0.015"),
                price("anthropic", "claude-3-5-haiku", "0.0008", "0.004"),
                price("anthropic", "claude-3-opus", "0.015", "0.075"),
                price("anthropic", "claude-3-haiku", "0.00025", "0.00125"));
        pricingRepository.saveAll(defaults);
        log.info("Seeded {} global model prices", defaults.size());
    }

    private static ModelPricing price(String provider, String model, String inputPer1k, String outputPer1k) {
        return ModelPricing.builder()
                .provider(provider)
                .model(model)
                .inputPricePer1k(new BigDecimal(inputPer1k))
                .outputPricePer1k(new BigDecimal(outputPer1k))
                .build();
    }
}
