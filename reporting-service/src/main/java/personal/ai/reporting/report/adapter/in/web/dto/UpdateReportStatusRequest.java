package personal.ai.reporting.report.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.ai.reporting.report.domain.model.ReportStatus;

/**
 * 보고서 상태 변경 요청 DTO
 */
public record UpdateReportStatusRequest(
        @NotNull(message = "상태는 필수입니다.")
        ReportStatus status,

        @Min(value = 0, message = "진행률은 0 이상이어야 합니다.")
        @Max(value = 100, message = "진행률은 100 이하여야 합니다.")
        int progressPercent,

        @Min(value = 0, message = "생성된 행 수는 0 이상이어야 합니다.")
        int rowsGenerated
) {
}
