package com.example.tracepipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "trace")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trace {

    @Id
    private String id;

    @Column(nullable = false)
    private String projectId;

    private String name;

    @Column(columnDefinition = "TEXT")
    private String input;

    @Column(columnDefinition = "TEXT")
    private String output;

    private Instant startTime;

    private Long durationMs;

    @Column(precision = 20, scale = 10)
    private BigDecimal totalCost;
}
