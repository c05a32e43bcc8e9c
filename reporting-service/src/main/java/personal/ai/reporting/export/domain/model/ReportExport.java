package personal.ai.reporting.export.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Report Export Domain Model
 * 보고서를 특정 형식으로 내보낸 파일과 다운로드 이력 (불변)
 */
public record ReportExport(
        Long id,
        Long reportId,
        String format,
        String filePath,
        Long fileSize,
        String fileHash,
        ExportStatus status,
        LocalDateTime exportedAt,
        int downloadCount,
        LocalDateTime lastDownloadedAt,
        String compressionType,
        String errorMessage,
        LocalDateTime createdAt) {

    public ReportExport {
        if (reportId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Report ID cannot be null");
        }
        if (format == null || format.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Export format cannot be null or blank");
        }
        if (filePath == null || filePath.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "File path cannot be null or blank");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Export status cannot be null");
        }
        if (downloadCount < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Download count cannot be negative");
        }
    }

    public static ReportExport create(Long reportId, String format, String filePath, Long fileSize) {
        return new ReportExport(null, reportId, format, filePath, fileSize, null, ExportStatus.PENDING,
                null, 0, null, null, null, null);
    }

    /**
     * 내보내기 완료 (-> COMPLETED)
     * 파일 크기와 해시는 값이 주어진 경우에만 덮어씀
     */
    public ReportExport markCompleted(Long newFileSize, String newFileHash, LocalDateTime now) {
        return new ReportExport(id, reportId, format, filePath,
                newFileSize != null ? newFileSize : fileSize,
                newFileHash != null ? newFileHash : fileHash,
                ExportStatus.COMPLETED, now, downloadCount, lastDownloadedAt, compressionType,
                errorMessage, createdAt);
    }

    public ReportExport markFailed(String reason) {
        return new ReportExport(id, reportId, format, filePath, fileSize, fileHash, ExportStatus.FAILED,
                exportedAt, downloadCount, lastDownloadedAt, compressionType, reason, createdAt);
    }

    public ReportExport recordDownload(LocalDateTime now) {
        return new ReportExport(id, reportId, format, filePath, fileSize, fileHash, status,
                exportedAt, downloadCount + 1, now, compressionType, errorMessage, createdAt);
    }
}
