package personal.ai.reporting.schedule.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import personal.ai.reporting.schedule.domain.model.TimeOfDay;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScheduleClock 단위 테스트")
class ScheduleClockTest {

    private static final TimeOfDay EIGHT_AM = new TimeOfDay(8, 0);

    @Test
    @DisplayName("daily - 실행 시각이 이미 지났으면 다음 날 같은 시각")
    void daily_PastTimeRollsToNextDay() {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 1, 1, 9, 0);

        // when
        LocalDateTime next = ScheduleClock.computeNextRun("daily", EIGHT_AM, now);

        // then
        assertThat(next).isEqualTo(LocalDateTime.of(2024, 1, 2, 8, 0));
    }

    @Test
    @DisplayName("daily - 실행 시각이 아직 남았으면 오늘")
    void daily_FutureTimeIsToday() {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 1, 1, 7, 30);

        // when
        LocalDateTime next = ScheduleClock.computeNextRun("daily", EIGHT_AM, now);

        // then
        assertThat(next).isEqualTo(LocalDateTime.of(2024, 1, 1, 8, 0));
    }

    @Test
    @DisplayName("daily - 실행 시각과 현재 시각이 같으면 다음 날")
    void daily_SameInstantRollsToNextDay() {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 1, 1, 8, 0);

        // when
        LocalDateTime next = ScheduleClock.computeNextRun("daily", EIGHT_AM, now);

        // then
        assertThat(next).isEqualTo(LocalDateTime.of(2024, 1, 2, 8, 0));
    }

    @Test
    @DisplayName("weekly - 실행 시각이 지났으면 7일 뒤 (요일은 고려하지 않음)")
    void weekly_PastTimeRollsSevenDays() {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 1, 3, 12, 0);

        // when
        LocalDateTime next = ScheduleClock.computeNextRun("weekly", EIGHT_AM, now);

        // then
        assertThat(next).isEqualTo(LocalDateTime.of(2024, 1, 10, 8, 0));
    }

    @Test
    @DisplayName("monthly - 이번 달 1일이 지났으면 다음 달 1일")
    void monthly_RollsToFirstOfNextMonth() {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 1, 31, 23, 0);

        // when
        LocalDateTime next = ScheduleClock.computeNextRun("monthly", EIGHT_AM, now);

        // then
        assertThat(next).isEqualTo(LocalDateTime.of(2024, 2, 1, 8, 0));
    }

    @Test
    @DisplayName("monthly - 1일 실행 시각 이전이면 오늘")
    void monthly_FirstDayBeforeTime() {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 3, 1, 6, 0);

        // when
        LocalDateTime next = ScheduleClock.computeNextRun("monthly", EIGHT_AM, now);

        // then
        assertThat(next).isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 0));
    }

    @Test
    @DisplayName("monthly - 12월에서 다음 해 1월로 넘어감")
    void monthly_YearRollover() {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 12, 15, 10, 0);

        // when
        LocalDateTime next = ScheduleClock.computeNextRun("monthly", EIGHT_AM, now);

        // then
        assertThat(next).isEqualTo(LocalDateTime.of(2025, 1, 1, 8, 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"quarterly", "yearly", "Daily", "WEEKLY", ""})
    @DisplayName("알 수 없는 주기는 현재 시각 + 1일")
    void unknownFrequency_NowPlusOneDay(String frequency) {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 5, 10, 13, 45, 12);

        // when
        LocalDateTime next = ScheduleClock.computeNextRun(frequency, EIGHT_AM, now);

        // then
        assertThat(next).isEqualTo(now.plusDays(1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"daily", "weekly", "monthly"})
    @DisplayName("알려진 주기의 다음 실행 시각은 항상 현재 시각 이후")
    void knownFrequency_AlwaysAfterNow(String frequency) {
        LocalDateTime now = LocalDateTime.of(2024, 2, 29, 0, 0);
        for (int hour = 0; hour < 24; hour++) {
            LocalDateTime next = ScheduleClock.computeNextRun(frequency, new TimeOfDay(hour, 0), now);
            assertThat(next).isAfter(now);
        }
    }
}
