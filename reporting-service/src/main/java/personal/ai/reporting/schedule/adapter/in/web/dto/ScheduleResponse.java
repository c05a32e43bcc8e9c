package personal.ai.reporting.schedule.adapter.in.web.dto;

import personal.ai.reporting.schedule.domain.model.Schedule;

import java.time.LocalDateTime;

/**
 * 스케줄 응답 DTO
 */
public record ScheduleResponse(
        Long id,
        Long userId,
        Long templateId,
        String scheduleName,
        String frequency,
        String timeOfDay,
        boolean isEnabled,
        LocalDateTime nextRunAt,
        LocalDateTime lastRunAt,
        int runCount,
        int successCount,
        int failureCount,
        LocalDateTime createdAt
) {
    public static ScheduleResponse from(Schedule schedule) {
        return new ScheduleResponse(
                schedule.id(),
                schedule.userId(),
                schedule.templateId(),
                schedule.name(),
                schedule.frequency(),
                schedule.timeOfDay().format(),
                schedule.enabled(),
                schedule.nextRunAt(),
                schedule.lastRunAt(),
                schedule.runCount(),
                schedule.successCount(),
                schedule.failureCount(),
                schedule.createdAt()
        );
    }
}
