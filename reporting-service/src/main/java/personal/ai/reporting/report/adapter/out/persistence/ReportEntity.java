package personal.ai.reporting.report.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.reporting.report.domain.model.GenerationSource;
import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.report.domain.model.ReportStatus;
import personal.ai.reporting.support.JsonMapConverter;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Report JPA Entity
 */
@Entity
@Table(name = "reports",
        indexes = {
                @Index(name = "idx_reports_user_status", columnList = "user_id, status"),
                @Index(name = "idx_reports_type_created", columnList = "report_type, created_at"),
                @Index(name = "idx_reports_generated_status", columnList = "status, generated_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "template_id", nullable = false)
    private Long templateId;

    @Column(name = "report_name", nullable = false)
    private String name;

    @Column(name = "report_type", nullable = false, length = 50)
    private String type;

    @Column(name = "date_range_start", nullable = false)
    private LocalDateTime dateRangeStart;

    @Column(name = "date_range_end", nullable = false)
    private LocalDateTime dateRangeEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private ReportStatus status;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent;

    @Column(name = "total_records", nullable = false)
    private int totalRecords;

    @Column(name = "rows_generated", nullable = false)
    private int rowsGenerated;

    @Column(name = "generated_at")
    private LocalDateTime generatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "generated_by", length = 50)
    private GenerationSource generatedBy;

    @Column(name = "file_path", length = 500)
    private String filePath;

    @Column(name = "file_size")
    private Long fileSize;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> filters;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "generation_time_seconds")
    private Double generationTimeSeconds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static ReportEntity fromDomain(Report report) {
        ReportEntity entity = new ReportEntity();
        entity.id = report.id();
        entity.userId = report.userId();
        entity.templateId = report.templateId();
        entity.name = report.name();
        entity.type = report.type();
        entity.dateRangeStart = report.dateRangeStart();
        entity.dateRangeEnd = report.dateRangeEnd();
        entity.status = report.status();
        entity.progressPercent = report.progressPercent();
        entity.totalRecords = report.totalRecords();
        entity.rowsGenerated = report.rowsGenerated();
        entity.generatedAt = report.generatedAt();
        entity.generatedBy = report.generatedBy();
        entity.filePath = report.filePath();
        entity.fileSize = report.fileSize();
        entity.filters = report.filters();
        entity.errorMessage = report.errorMessage();
        entity.generationTimeSeconds = report.generationTimeSeconds();
        entity.createdAt = report.createdAt();
        return entity;
    }

    /**
     * 생성/수정 시각은 주입된 Clock 기준으로 어댑터가 기록
     */
    void touch(LocalDateTime now) {
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    public Report toDomain() {
        return new Report(id, userId, templateId, name, type, dateRangeStart, dateRangeEnd, status,
                progressPercent, totalRecords, rowsGenerated, generatedAt, generatedBy, filePath, fileSize,
                filters, errorMessage, generationTimeSeconds, createdAt);
    }
}
