package personal.ai.reporting.metric.application.port.out;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.metric.domain.model.ReportMetric;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Report Metric Repository (Output Port)
 */
public interface ReportMetricRepository {

    ReportMetric save(ReportMetric metric);

    PageResponse<ReportMetric> findByReportId(Long reportId, int limit, int offset);

    PageResponse<ReportMetric> findByCategory(String category, int limit, int offset);

    List<BigDecimal> findValuesByNameSince(String metricName, LocalDateTime since);
}
