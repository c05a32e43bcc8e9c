package personal.ai.reporting.metric.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.reporting.metric.domain.model.ReportMetric;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Report Metric JPA Entity
 */
@Entity
@Table(name = "report_metrics",
        indexes = {
                @Index(name = "idx_report_metrics_report_name", columnList = "report_id, metric_name"),
                @Index(name = "idx_report_metrics_category", columnList = "metric_category, recorded_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReportMetricEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_id", nullable = false)
    private Long reportId;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String name;

    @Column(name = "metric_value", nullable = false, precision = 12, scale = 2)
    private BigDecimal value;

    @Column(name = "metric_unit", length = 50)
    private String unit;

    @Column(name = "metric_category", length = 50)
    private String category;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static ReportMetricEntity fromDomain(ReportMetric metric) {
        ReportMetricEntity entity = new ReportMetricEntity();
        entity.id = metric.id();
        entity.reportId = metric.reportId();
        entity.name = metric.name();
        entity.value = metric.value();
        entity.unit = metric.unit();
        entity.category = metric.category();
        entity.recordedAt = metric.recordedAt();
        return entity;
    }

    public ReportMetric toDomain() {
        return new ReportMetric(id, reportId, name, value, unit, category, recordedAt);
    }
}
