package personal.ai.reporting.export.application.port.out;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.export.domain.model.ReportExport;

import java.util.Optional;

/**
 * Report Export Repository (Output Port)
 */
public interface ReportExportRepository {

    ReportExport save(ReportExport export);

    Optional<ReportExport> findById(Long exportId);

    PageResponse<ReportExport> findByReportId(Long reportId, int limit, int offset);
}
