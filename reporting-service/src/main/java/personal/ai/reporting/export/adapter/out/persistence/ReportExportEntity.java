package personal.ai.reporting.export.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.reporting.export.domain.model.ExportStatus;
import personal.ai.reporting.export.domain.model.ReportExport;

import java.time.LocalDateTime;

/**
 * Report Export JPA Entity
 */
@Entity
@Table(name = "report_exports",
        indexes = {
                @Index(name = "idx_report_exports_report_format", columnList = "report_id, export_format"),
                @Index(name = "idx_report_exports_status", columnList = "export_status, created_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReportExportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_id", nullable = false)
    private Long reportId;

    @Column(name = "export_format", nullable = false, length = 20)
    private String format;

    @Column(name = "file_path", nullable = false, length = 500)
    private String filePath;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "file_hash", length = 100)
    private String fileHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "export_status", nullable = false, length = 50)
    private ExportStatus status;

    @Column(name = "exported_at")
    private LocalDateTime exportedAt;

    @Column(name = "download_count", nullable = false)
    private int downloadCount;

    @Column(name = "last_downloaded_at")
    private LocalDateTime lastDownloadedAt;

    @Column(name = "compression_type", length = 20)
    private String compressionType;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static ReportExportEntity fromDomain(ReportExport export) {
        ReportExportEntity entity = new ReportExportEntity();
        entity.id = export.id();
        entity.reportId = export.reportId();
        entity.format = export.format();
        entity.filePath = export.filePath();
        entity.fileSize = export.fileSize();
        entity.fileHash = export.fileHash();
        entity.status = export.status();
        entity.exportedAt = export.exportedAt();
        entity.downloadCount = export.downloadCount();
        entity.lastDownloadedAt = export.lastDownloadedAt();
        entity.compressionType = export.compressionType();
        entity.errorMessage = export.errorMessage();
        entity.createdAt = export.createdAt();
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

    public ReportExport toDomain() {
        return new ReportExport(id, reportId, format, filePath, fileSize, fileHash, status, exportedAt,
                downloadCount, lastDownloadedAt, compressionType, errorMessage, createdAt);
    }
}
