package personal.ai.reporting.schedule.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.reporting.schedule.domain.service.ScheduleClock;

import java.time.LocalDateTime;

/**
 * Schedule Domain Model
 * 반복 보고서 생성 스케줄 (불변)
 * <p>
 * 실행 결과를 기록할 때마다 runCount = successCount + failureCount 관계가 유지됨
 */
public record Schedule(
        Long id,
        Long userId,
        Long templateId,
        String name,
        String frequency,
        TimeOfDay timeOfDay,
        Integer dayOfWeek,
        Integer dayOfMonth,
        String timezone,
        boolean enabled,
        LocalDateTime nextRunAt,
        LocalDateTime lastRunAt,
        int runCount,
        int successCount,
        int failureCount,
        DeliveryTarget delivery,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public static final String DEFAULT_TIMEZONE = "UTC";

    public Schedule {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (templateId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Template ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Schedule name cannot be null or blank");
        }
        if (frequency == null || frequency.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Frequency cannot be null or blank");
        }
        if (timeOfDay == null) {
            throw new BusinessException(ErrorCode.INVALID_TIME_OF_DAY, "Time of day cannot be null");
        }
        if (dayOfWeek != null && (dayOfWeek < 0 || dayOfWeek > 6)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Day of week must be between 0 and 6: " + dayOfWeek);
        }
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Day of month must be between 1 and 31: " + dayOfMonth);
        }
        if (runCount < 0 || successCount < 0 || failureCount < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Execution counters cannot be negative");
        }
        timezone = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone;
        delivery = delivery == null ? new DeliveryTarget(null, null, null, true) : delivery;
    }

    /**
     * 스케줄 생성 (정적 팩토리 메서드)
     * 다음 실행 시각은 생성 시점 기준으로 계산
     */
    public static Schedule create(Long userId, Long templateId, String name, String frequency,
                                  TimeOfDay timeOfDay, Integer dayOfWeek, Integer dayOfMonth,
                                  String timezone, DeliveryTarget delivery, LocalDateTime now) {
        LocalDateTime nextRunAt = ScheduleClock.computeNextRun(frequency, timeOfDay, now);
        return new Schedule(null, userId, templateId, name, frequency, timeOfDay, dayOfWeek, dayOfMonth,
                timezone, true, nextRunAt, null, 0, 0, 0, delivery, null, null);
    }

    /**
     * 실행 결과 기록
     * 실패한 경우에만 다음 실행 시각을 now 기준으로 다시 계산하고, 성공 시에는 그대로 둠
     */
    public Schedule recordExecution(boolean succeeded, LocalDateTime now) {
        LocalDateTime newNextRunAt = succeeded
                ? nextRunAt
                : ScheduleClock.computeNextRun(frequency, timeOfDay, now);
        return new Schedule(id, userId, templateId, name, frequency, timeOfDay, dayOfWeek, dayOfMonth,
                timezone, enabled, newNextRunAt, now,
                runCount + 1,
                succeeded ? successCount + 1 : successCount,
                succeeded ? failureCount : failureCount + 1,
                delivery, createdAt, updatedAt);
    }

    /**
     * 다음 실행 시각을 now 기준으로 재계산
     */
    public Schedule advanceNextRun(LocalDateTime now) {
        return new Schedule(id, userId, templateId, name, frequency, timeOfDay, dayOfWeek, dayOfMonth,
                timezone, enabled, ScheduleClock.computeNextRun(frequency, timeOfDay, now), lastRunAt,
                runCount, successCount, failureCount, delivery, createdAt, updatedAt);
    }

    public boolean isDue(LocalDateTime now) {
        return enabled && nextRunAt != null && !nextRunAt.isAfter(now);
    }
}
