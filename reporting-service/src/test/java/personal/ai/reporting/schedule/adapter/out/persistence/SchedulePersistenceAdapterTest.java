package personal.ai.reporting.schedule.adapter.out.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import personal.ai.reporting.schedule.domain.model.DeliveryTarget;
import personal.ai.reporting.schedule.domain.model.Schedule;
import personal.ai.reporting.schedule.domain.model.TimeOfDay;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({SchedulePersistenceAdapter.class, SchedulePersistenceAdapterTest.FixedClockConfig.class})
@DisplayName("SchedulePersistenceAdapter 저장소 테스트")
class SchedulePersistenceAdapterTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 9, 0);

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-01-01T09:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private SchedulePersistenceAdapter schedulePersistenceAdapter;
    @Autowired
    private TestEntityManager entityManager;

    private Schedule saveSchedule(String name, LocalDateTime nextRunAt, boolean enabled) {
        Schedule schedule = new Schedule(null, 1L, 10L, name, "daily", new TimeOfDay(8, 0),
                null, null, "UTC", enabled, nextRunAt, null, 0, 0, 0,
                new DeliveryTarget("email", List.of("ops@example.com"), null, true), null, null);
        return schedulePersistenceAdapter.save(schedule);
    }

    private void softDelete(Long scheduleId) {
        entityManager.getEntityManager()
                .createQuery("UPDATE ScheduleEntity s SET s.deleted = true WHERE s.id = :id")
                .setParameter("id", scheduleId)
                .executeUpdate();
        entityManager.clear();
    }

    @Test
    @DisplayName("한 시간 전이 실행 시각인 스케줄은 실행 대상")
    void findDue_PastSchedule() {
        // given
        Schedule past = saveSchedule("Past", NOW.minusHours(1), true);
        entityManager.flush();
        entityManager.clear();

        // when
        List<Schedule> due = schedulePersistenceAdapter.findDue(NOW);

        // then
        assertThat(due).extracting(Schedule::id).containsExactly(past.id());
    }

    @Test
    @DisplayName("한 시간 뒤가 실행 시각인 스케줄은 실행 대상 아님")
    void findDue_FutureSchedule() {
        // given
        saveSchedule("Future", NOW.plusHours(1), true);
        entityManager.flush();
        entityManager.clear();

        // when & then
        assertThat(schedulePersistenceAdapter.findDue(NOW)).isEmpty();
    }

    @Test
    @DisplayName("비활성화되거나 삭제된 스케줄은 실행 대상에서 제외, 실행 시각이 정확히 now면 포함")
    void findDue_ExcludesDisabledAndDeleted() {
        // given
        Schedule boundary = saveSchedule("Boundary", NOW, true);
        saveSchedule("Disabled", NOW.minusHours(1), false);
        Schedule deleted = saveSchedule("Deleted", NOW.minusHours(1), true);
        entityManager.flush();
        softDelete(deleted.id());

        // when
        List<Schedule> due = schedulePersistenceAdapter.findDue(NOW);

        // then
        assertThat(due).extracting(Schedule::name).containsExactly("Boundary");
        assertThat(due.get(0).id()).isEqualTo(boundary.id());
    }

    @Test
    @DisplayName("삭제된 스케줄은 일반 조회와 잠금 조회 모두에서 제외")
    void findById_ExcludesDeleted() {
        // given
        Schedule deleted = saveSchedule("Deleted", NOW.minusHours(1), true);
        Schedule alive = saveSchedule("Alive", NOW.minusHours(1), true);
        entityManager.flush();
        softDelete(deleted.id());

        // when & then
        assertThat(schedulePersistenceAdapter.findById(deleted.id())).isEmpty();
        assertThat(schedulePersistenceAdapter.findByIdForUpdate(deleted.id())).isEmpty();
        assertThat(schedulePersistenceAdapter.findByIdForUpdate(alive.id()))
                .get()
                .extracting(Schedule::name)
                .isEqualTo("Alive");
    }

    @Test
    @DisplayName("생성/수정 시각은 주입된 Clock 기준으로 기록")
    void save_StampsTimesFromClock() {
        // when
        Schedule saved = saveSchedule("Clocked", NOW.plusDays(1), true);

        // then
        assertThat(saved.createdAt()).isEqualTo(NOW);
        assertThat(saved.updatedAt()).isEqualTo(NOW);
    }
}
