package personal.ai.reporting.report.adapter.in.web.dto;

import personal.ai.reporting.report.domain.model.GenerationSource;
import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.report.domain.model.ReportStatus;

import java.time.LocalDateTime;

/**
 * 보고서 응답 DTO
 */
public record ReportResponse(
        Long id,
        Long userId,
        Long templateId,
        String reportName,
        String reportType,
        LocalDateTime dateRangeStart,
        LocalDateTime dateRangeEnd,
        ReportStatus status,
        int progressPercent,
        int totalRecords,
        LocalDateTime generatedAt,
        GenerationSource generatedBy,
        Long fileSize,
        Double generationTimeSeconds,
        LocalDateTime createdAt
) {
    public static ReportResponse from(Report report) {
        return new ReportResponse(
                report.id(),
                report.userId(),
                report.templateId(),
                report.name(),
                report.type(),
                report.dateRangeStart(),
                report.dateRangeEnd(),
                report.status(),
                report.progressPercent(),
                report.totalRecords(),
                report.generatedAt(),
                report.generatedBy(),
                report.fileSize(),
                report.generationTimeSeconds(),
                report.createdAt()
        );
    }
}
