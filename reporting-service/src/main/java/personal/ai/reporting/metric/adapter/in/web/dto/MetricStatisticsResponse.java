package personal.ai.reporting.metric.adapter.in.web.dto;

import personal.ai.reporting.metric.domain.model.MetricStatistics;

/**
 * 지표 통계 응답 DTO
 */
public record MetricStatisticsResponse(
        String metricName,
        int periodDays,
        double average,
        long count,
        double min,
        double max
) {
    public static MetricStatisticsResponse of(String metricName, int periodDays, MetricStatistics statistics) {
        return new MetricStatisticsResponse(metricName, periodDays, statistics.average(), statistics.count(),
                statistics.min(), statistics.max());
    }
}
