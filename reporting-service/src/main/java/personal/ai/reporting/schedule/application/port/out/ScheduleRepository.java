package personal.ai.reporting.schedule.application.port.out;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.schedule.domain.model.Schedule;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Schedule Repository (Output Port)
 * 삭제된 스케줄은 모든 조회에서 제외
 */
public interface ScheduleRepository {

    Schedule save(Schedule schedule);

    Optional<Schedule> findById(Long scheduleId);

    /**
     * 비관적 쓰기 락으로 조회 (트랜잭션 내에서만 호출)
     */
    Optional<Schedule> findByIdForUpdate(Long scheduleId);

    /**
     * 활성화되어 있고 nextRunAt <= now 인 스케줄
     */
    List<Schedule> findDue(LocalDateTime now);

    PageResponse<Schedule> findByUserId(Long userId, int limit, int offset);
}
