package com.bybot.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "metric_points")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricPoint {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String category;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "metric_value", nullable = false)
    private double metricValue;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
