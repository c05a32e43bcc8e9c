package personal.ai.reporting.report.application.port.in;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.report.domain.model.ReportStatus;

/**
 * Get Report UseCase (Input Port)
 */
public interface GetReportUseCase {

    /**
     * 보고서 조회
     *
     * @param reportId 보고서 ID
     * @param userId   지정 시 해당 사용자의 보고서만 조회 (nullable)
     * @throws personal.ai.reporting.report.domain.exception.ReportNotFoundException 보고서가 없거나 소유자가 다를 때
     */
    Report getReport(Long reportId, Long userId);

    PageResponse<Report> getUserReports(Long userId, ReportStatus status, int limit, int offset);
}
