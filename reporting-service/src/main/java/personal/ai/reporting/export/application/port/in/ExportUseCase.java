package personal.ai.reporting.export.application.port.in;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.export.domain.model.ReportExport;

/**
 * Report Export UseCase (Input Port)
 */
public interface ExportUseCase {

    /**
     * 내보내기 생성 (PENDING)
     *
     * @throws personal.ai.reporting.report.domain.exception.ReportNotFoundException 보고서가 없을 때
     */
    ReportExport createExport(CreateExportCommand command);

    ReportExport markCompleted(Long exportId, Long fileSize, String fileHash);

    ReportExport markFailed(Long exportId, String errorMessage);

    /**
     * 다운로드 횟수 증가 및 마지막 다운로드 시각 기록
     */
    ReportExport recordDownload(Long exportId);

    PageResponse<ReportExport> getReportExports(Long reportId, int limit, int offset);
}
