package personal.ai.reporting.export.adapter.in.web.dto;

import personal.ai.reporting.export.domain.model.ExportStatus;
import personal.ai.reporting.export.domain.model.ReportExport;

import java.time.LocalDateTime;

/**
 * 내보내기 응답 DTO
 */
public record ExportResponse(
        Long id,
        Long reportId,
        String exportFormat,
        Long fileSize,
        ExportStatus exportStatus,
        LocalDateTime exportedAt,
        int downloadCount,
        LocalDateTime lastDownloadedAt,
        LocalDateTime createdAt
) {
    public static ExportResponse from(ReportExport export) {
        return new ExportResponse(
                export.id(),
                export.reportId(),
                export.format(),
                export.fileSize(),
                export.status(),
                export.exportedAt(),
                export.downloadCount(),
                export.lastDownloadedAt(),
                export.createdAt()
        );
    }
}
