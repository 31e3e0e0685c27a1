package org.theridian.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.theridian.models.enums.MetricType;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "metrics_data", indexes = {
        @Index(name = "idx_metrics_name_recorded", columnList = "metric_name, recorded_at"),
        @Index(name = "idx_metrics_recorded", columnList = "recorded_at")
})
public class MetricData {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "metric_id", nullable = false)
    private Long id;

    @Column(name = "metric_uid", nullable = false, length = 40, unique = true)
    private String metricUid;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String metricName;

    @Column(name = "metric_value", nullable = false)
    private double metricValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "metric_type", nullable = false, length = 20)
    private MetricType metricType = MetricType.GAUGE;

    @Column(name = "labels", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, String> labels = new HashMap<>();

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
