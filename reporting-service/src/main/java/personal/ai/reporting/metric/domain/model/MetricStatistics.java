package personal.ai.reporting.metric.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * 기간 내 지표 통계
 * 관측값이 없으면 모든 값이 0
 */
public record MetricStatistics(
        double average,
        long count,
        double min,
        double max) {

    public static MetricStatistics empty() {
        return new MetricStatistics(0, 0, 0, 0);
    }

    public static MetricStatistics of(List<BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            return empty();
        }
        var summary = values.stream()
                .mapToDouble(BigDecimal::doubleValue)
                .summaryStatistics();
        return new MetricStatistics(summary.getAverage(), summary.getCount(), summary.getMin(), summary.getMax());
    }
}
