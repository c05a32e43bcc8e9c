package personal.ai.reporting.schedule.domain.service;

import personal.ai.reporting.schedule.domain.model.Frequency;
import personal.ai.reporting.schedule.domain.model.TimeOfDay;

import java.time.LocalDateTime;

/**
 * Schedule Clock
 * 반복 주기와 실행 시각으로 다음 실행 시각을 계산하는 순수 함수
 * <p>
 * daily/weekly/monthly는 항상 now 이후의 시각을 반환
 */
public final class ScheduleClock {

    private static final int MONTH_ROLLOVER_DAYS = 32;

    private ScheduleClock() {
        // Utility class
    }

    /**
     * 다음 실행 시각 계산
     * <ul>
     *   <li>daily: 오늘 실행 시각, 이미 지났으면 +1일</li>
     *   <li>weekly: 오늘 실행 시각, 이미 지났으면 +7일 (요일 고정 없음)</li>
     *   <li>monthly: 이번 달 1일 실행 시각, 이미 지났으면 다음 달 1일</li>
     *   <li>그 외: now + 1일</li>
     * </ul>
     *
     * @param frequency 저장된 주기 문자열
     * @param timeOfDay 실행 시각
     * @param now       기준 시각
     */
    public static LocalDateTime computeNextRun(String frequency, TimeOfDay timeOfDay, LocalDateTime now) {
        LocalDateTime today = now.toLocalDate().atTime(timeOfDay.toLocalTime());

        return switch (Frequency.from(frequency)) {
            case DAILY -> today.isAfter(now) ? today : today.plusDays(1);
            case WEEKLY -> today.isAfter(now) ? today : today.plusDays(7);
            case MONTHLY -> {
                LocalDateTime firstOfMonth = today.withDayOfMonth(1);
                yield firstOfMonth.isAfter(now)
                        ? firstOfMonth
                        : firstOfMonth.plusDays(MONTH_ROLLOVER_DAYS).withDayOfMonth(1);
            }
            case OTHER -> now.plusDays(1);
        };
    }
}
