package personal.ai.reporting.metric.adapter.in.web.dto;

import personal.ai.reporting.metric.domain.model.ReportMetric;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 지표 응답 DTO
 */
public record MetricResponse(
        Long id,
        Long reportId,
        String metricName,
        BigDecimal metricValue,
        String metricUnit,
        String metricCategory,
        LocalDateTime recordedAt
) {
    public static MetricResponse from(ReportMetric metric) {
        return new MetricResponse(
                metric.id(),
                metric.reportId(),
                metric.name(),
                metric.value(),
                metric.unit(),
                metric.category(),
                metric.recordedAt()
        );
    }
}
