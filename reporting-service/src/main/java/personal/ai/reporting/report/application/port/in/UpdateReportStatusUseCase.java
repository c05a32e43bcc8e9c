package personal.ai.reporting.report.application.port.in;

import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.report.domain.model.ReportStatus;

/**
 * Update Report Status UseCase (Input Port)
 * 외부 생성기가 보고하는 진행 상태를 반영
 */
public interface UpdateReportStatusUseCase {

    Report updateStatus(Long reportId, ReportStatus status, int progressPercent, int rowsGenerated);

    Report markCompleted(Long reportId, int totalRecords, double generationTimeSeconds,
                         String filePath, Long fileSize);

    Report markFailed(Long reportId, String errorMessage);
}
