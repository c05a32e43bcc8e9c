package personal.ai.reporting.report.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.ai.reporting.report.application.port.in.CreateReportCommand;
import personal.ai.reporting.report.domain.model.GenerationSource;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 보고서 생성 요청 DTO
 */
public record CreateReportRequest(
        @NotNull(message = "사용자 ID는 필수입니다.")
        @Positive(message = "사용자 ID는 양수여야 합니다.")
        Long userId,

        @NotNull(message = "템플릿 ID는 필수입니다.")
        @Positive(message = "템플릿 ID는 양수여야 합니다.")
        Long templateId,

        @NotBlank(message = "보고서 이름은 필수입니다.")
        @Size(max = 255, message = "보고서 이름은 255자 이하여야 합니다.")
        String reportName,

        @NotBlank(message = "보고서 유형은 필수입니다.")
        @Size(max = 50, message = "보고서 유형은 50자 이하여야 합니다.")
        String reportType,

        @NotNull(message = "조회 시작일은 필수입니다.")
        LocalDateTime dateRangeStart,

        @NotNull(message = "조회 종료일은 필수입니다.")
        LocalDateTime dateRangeEnd,

        Map<String, Object> filters
) {
    public CreateReportCommand toCommand() {
        return new CreateReportCommand(userId, templateId, reportName, reportType,
                dateRangeStart, dateRangeEnd, filters, GenerationSource.MANUAL);
    }
}
