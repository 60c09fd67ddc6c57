package com.example.tracepipeline.worker.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdCheckPayload {
    private String traceId;
    private String projectId;
}
