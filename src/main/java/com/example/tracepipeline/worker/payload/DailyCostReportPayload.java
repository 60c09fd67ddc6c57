package com.example.tracepipeline.worker.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * notification:daily_cost_report 载荷，projectId 为空时发给所有有订阅者的项目。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DailyCostReportPayload {
    private String projectId;
    private String date; // yyyy-MM-dd
}
