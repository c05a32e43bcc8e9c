package personal.ai.reporting.metric.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Report Metric Domain Model
 * 보고서(또는 템플릿)에 연결된 수치 관측값 (추가 전용, 불변)
 * <p>
 * 값은 소수점 둘째 자리까지 반올림(HALF_UP)하여 보관
 */
public record ReportMetric(
        Long id,
        Long reportId,
        String name,
        BigDecimal value,
        String unit,
        String category,
        LocalDateTime recordedAt) {

    public static final String DEFAULT_CATEGORY = "performance";
    private static final int VALUE_SCALE = 2;

    public ReportMetric {
        if (reportId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Report ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Metric name cannot be null or blank");
        }
        if (value == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Metric value cannot be null");
        }
        value = value.setScale(VALUE_SCALE, RoundingMode.HALF_UP);
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    }

    public static ReportMetric create(Long reportId, String name, double value, String unit, String category,
                                      LocalDateTime recordedAt) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Metric value must be a finite number: " + value);
        }
        return new ReportMetric(null, reportId, name, BigDecimal.valueOf(value), unit, category, recordedAt);
    }
}
