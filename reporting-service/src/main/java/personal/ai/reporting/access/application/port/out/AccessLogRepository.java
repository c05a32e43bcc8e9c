package personal.ai.reporting.access.application.port.out;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.access.domain.model.AccessLog;

import java.util.List;

/**
 * Access Log Repository (Output Port)
 */
public interface AccessLogRepository {

    AccessLog save(AccessLog accessLog);

    PageResponse<AccessLog> findByReportId(Long reportId, int limit, int offset);

    PageResponse<AccessLog> findByUserId(Long userId, int limit, int offset);

    List<AccessLog> findAllByReportId(Long reportId);
}
