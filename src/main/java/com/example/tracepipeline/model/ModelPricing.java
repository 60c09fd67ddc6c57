package com.example.tracepipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "model_pricing")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelPricing {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String projectId; // null 表示全局默认价格

    @Column(nullable = false)
    private String model;

    private String provider;

    @Column(nullable = false, precision = 20, scale = 10)
    private BigDecimal inputPricePer1k;

    @Column(nullable = false, precision = 20, scale = 10)
    private BigDecimal outputPricePer1k;
}
