package personal.ai.reporting.schedule.application.port.in;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.schedule.domain.model.Schedule;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Get Schedule UseCase (Input Port)
 */
public interface GetScheduleUseCase {

    /**
     * @throws personal.ai.reporting.schedule.domain.exception.ScheduleNotFoundException 없거나 삭제된 경우
     */
    Schedule getSchedule(Long scheduleId);

    /**
     * 현재 시각 기준 실행 대상 스케줄 (순서 보장 없음)
     */
    List<Schedule> dueSchedules();

    List<Schedule> dueSchedules(LocalDateTime now);

    PageResponse<Schedule> getUserSchedules(Long userId, int limit, int offset);
}
