package personal.ai.reporting.report.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Report Not Found Exception
 */
public class ReportNotFoundException extends BusinessException {
    public ReportNotFoundException(Long reportId) {
        super(ErrorCode.REPORT_NOT_FOUND,
                String.format("Report not found: reportId=%d", reportId));
    }
}
