package com.example.tracepipeline.worker.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * cost:calculate 载荷
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CostCalculationPayload {
    private String projectId;
    private String traceId;
    private String observationId;
    private String model;
    private long promptTokens;
    private long completionTokens;
}
