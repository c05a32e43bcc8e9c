package personal.ai.reporting.report.application.port.out;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.report.domain.model.ReportStatus;

import java.util.Optional;

/**
 * Report Repository (Output Port)
 */
public interface ReportRepository {

    Report save(Report report);

    Optional<Report> findById(Long reportId);

    boolean existsById(Long reportId);

    /**
     * @param status null이면 전체 상태
     */
    PageResponse<Report> findByUserId(Long userId, ReportStatus status, int limit, int offset);
}
