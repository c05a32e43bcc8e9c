package personal.ai.reporting.metric.application.port.in;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.metric.domain.model.MetricStatistics;
import personal.ai.reporting.metric.domain.model.ReportMetric;

/**
 * Get Metric UseCase (Input Port)
 */
public interface GetMetricUseCase {

    PageResponse<ReportMetric> getReportMetrics(Long reportId, int limit, int offset);

    PageResponse<ReportMetric> getMetricsByCategory(String category, int limit, int offset);

    /**
     * 최근 days일 동안 기록된 지표의 평균/건수/최소/최대
     */
    MetricStatistics getAverageMetrics(String metricName, int days);
}
