package personal.ai.reporting.schedule.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.ai.reporting.schedule.application.port.in.CreateScheduleCommand;

import java.util.List;

/**
 * 스케줄 생성 요청 DTO
 * timeOfDay 형식 검증은 도메인(TimeOfDay.parse)에서 수행
 */
public record CreateScheduleRequest(
        @NotNull(message = "사용자 ID는 필수입니다.")
        @Positive(message = "사용자 ID는 양수여야 합니다.")
        Long userId,

        @NotNull(message = "템플릿 ID는 필수입니다.")
        @Positive(message = "템플릿 ID는 양수여야 합니다.")
        Long templateId,

        @NotBlank(message = "스케줄 이름은 필수입니다.")
        @Size(max = 255, message = "스케줄 이름은 255자 이하여야 합니다.")
        String scheduleName,

        @NotBlank(message = "반복 주기는 필수입니다.")
        @Size(max = 50, message = "반복 주기는 50자 이하여야 합니다.")
        String frequency,

        @NotBlank(message = "실행 시각은 필수입니다.")
        String timeOfDay,

        @Min(value = 0, message = "요일은 0~6 사이여야 합니다.")
        @Max(value = 6, message = "요일은 0~6 사이여야 합니다.")
        Integer dayOfWeek,

        @Min(value = 1, message = "일자는 1~31 사이여야 합니다.")
        @Max(value = 31, message = "일자는 1~31 사이여야 합니다.")
        Integer dayOfMonth,

        String timezone,
        List<String> recipients,
        String deliveryMethod,

        @Size(max = 500, message = "Webhook URL은 500자 이하여야 합니다.")
        String webhookUrl,

        Boolean includeFile
) {
    public CreateScheduleCommand toCommand() {
        return new CreateScheduleCommand(userId, templateId, scheduleName, frequency, timeOfDay,
                dayOfWeek, dayOfMonth, timezone, recipients, deliveryMethod, webhookUrl, includeFile);
    }
}
