package personal.ai.reporting.metric.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.ai.reporting.metric.application.port.in.RecordMetricCommand;

/**
 * 지표 기록 요청 DTO
 */
public record RecordMetricRequest(
        @NotNull(message = "보고서 ID는 필수입니다.")
        Long reportId,

        @NotBlank(message = "지표 이름은 필수입니다.")
        @Size(max = 100, message = "지표 이름은 100자 이하여야 합니다.")
        String metricName,

        @NotNull(message = "지표 값은 필수입니다.")
        Double metricValue,

        @NotBlank(message = "지표 단위는 필수입니다.")
        @Size(max = 50, message = "지표 단위는 50자 이하여야 합니다.")
        String metricUnit,

        @Size(max = 50, message = "지표 분류는 50자 이하여야 합니다.")
        String metricCategory
) {
    public RecordMetricCommand toCommand() {
        return new RecordMetricCommand(reportId, metricName, metricValue, metricUnit, metricCategory);
    }
}
