package personal.ai.reporting.access.application.port.in;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.access.domain.model.AccessLog;
import personal.ai.reporting.access.domain.model.AccessStatistics;

/**
 * Report Access Log UseCase (Input Port)
 */
public interface AccessLogUseCase {

    AccessLog logAccess(LogAccessCommand command);

    PageResponse<AccessLog> getReportAccessLogs(Long reportId, int limit, int offset);

    PageResponse<AccessLog> getUserAccessLogs(Long userId, int limit, int offset);

    AccessStatistics getAccessStatistics(Long reportId);
}
