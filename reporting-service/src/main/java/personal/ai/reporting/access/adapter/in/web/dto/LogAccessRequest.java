package personal.ai.reporting.access.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import personal.ai.reporting.access.application.port.in.LogAccessCommand;

/**
 * 접근 기록 요청 DTO
 */
public record LogAccessRequest(
        @NotNull(message = "보고서 ID는 필수입니다.")
        Long reportId,

        @NotNull(message = "사용자 ID는 필수입니다.")
        Long userId,

        @NotBlank(message = "접근 유형은 필수입니다.")
        @Size(max = 50, message = "접근 유형은 50자 이하여야 합니다.")
        String accessType,

        @Size(max = 50, message = "접근 상태는 50자 이하여야 합니다.")
        String accessStatus,

        @Size(max = 45, message = "IP 주소는 45자 이하여야 합니다.")
        String ipAddress,

        @Size(max = 500, message = "User-Agent는 500자 이하여야 합니다.")
        String userAgent,

        String errorMessage,

        @PositiveOrZero(message = "접근 시간은 0 이상이어야 합니다.")
        Integer durationSeconds
) {
    public LogAccessCommand toCommand() {
        return new LogAccessCommand(reportId, userId, accessType, accessStatus, ipAddress, userAgent,
                errorMessage, durationSeconds);
    }
}
