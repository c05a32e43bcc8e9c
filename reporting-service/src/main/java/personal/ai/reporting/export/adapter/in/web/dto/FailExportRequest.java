package personal.ai.reporting.export.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 내보내기 실패 요청 DTO
 */
public record FailExportRequest(
        @NotBlank(message = "오류 메시지는 필수입니다.")
        String errorMessage
) {
}
