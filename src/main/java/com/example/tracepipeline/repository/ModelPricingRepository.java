package com.example.tracepipeline.repository;

import com.example.tracepipeline.model.ModelPricing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ModelPricingRepository extends JpaRepository<ModelPricing, Long> {

    Optional<ModelPricing> findFirstByProjectIdAndModel(String projectId, String model);

    Optional<ModelPricing> findFirstByProjectIdIsNullAndModel(String model);

    /**
     * 全局默认价格表，用于前缀匹配带版本号的模型名
     */
    List<ModelPricing> findByProjectIdIsNull();
}
