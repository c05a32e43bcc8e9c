package personal.ai.reporting.schedule.application.port.in;

import java.util.List;

/**
 * 스케줄 생성 Command
 *
 * @param timeOfDay "HH:MM" 문자열 (파싱 전)
 */
public record CreateScheduleCommand(
        Long userId,
        Long templateId,
        String name,
        String frequency,
        String timeOfDay,
        Integer dayOfWeek,
        Integer dayOfMonth,
        String timezone,
        List<String> recipients,
        String deliveryMethod,
        String webhookUrl,
        Boolean includeFile
) {
}
