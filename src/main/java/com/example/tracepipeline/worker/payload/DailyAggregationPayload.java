package com.example.tracepipeline.worker.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * cost:aggregate-daily 载荷，两个字段都可省略（所有项目、昨天）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DailyAggregationPayload {
    private String projectId;
    private String date; // yyyy-MM-dd
}
