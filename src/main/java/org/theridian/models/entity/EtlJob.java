package org.theridian.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;
import org.theridian.models.enums.JobStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Tracked unit of ETL work. Status, timestamps, counters and the error message are owned by
 * {@link org.theridian.service.jobs.JobTransitionService}; nothing else writes them.
 */
@Getter
@Setter
@Entity
@Table(name = "etl_jobs", indexes = {
        @Index(name = "idx_etl_jobs_status_started", columnList = "status, started_at"),
        @Index(name = "idx_etl_jobs_created", columnList = "created_at")
})
public class EtlJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "etl_job_id", nullable = false)
    private Long id;

    @Column(name = "etl_job_uid", nullable = false, length = 40, unique = true)
    private String jobUid;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @ColumnDefault("'PENDING'")
    private JobStatus status = JobStatus.PENDING;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "data_source_id", nullable = false)
    private DataSource dataSource;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @ColumnDefault("0")
    @Column(name = "records_processed", nullable = false)
    private long recordsProcessed;

    @Column(name = "error_message", nullable = false, length = Integer.MAX_VALUE)
    private String errorMessage = "";

    @Column(name = "configuration", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> configuration = new HashMap<>();

    // failed attempts consumed by the current execution
    @ColumnDefault("0")
    @Column(name = "attempt", nullable = false)
    private int attempt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @ColumnDefault("now()")
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Wall time between start and completion, or {@code null} unless both timestamps are set.
     */
    @Transient
    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }
}
