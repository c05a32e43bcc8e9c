package personal.ai.reporting.schedule.application.port.in;

import personal.ai.reporting.schedule.domain.model.Schedule;

/**
 * Record Schedule Execution UseCase (Input Port)
 */
public interface RecordScheduleExecutionUseCase {

    /**
     * 실행 결과 기록
     * 실패 시에만 다음 실행 시각을 재계산
     *
     * @throws personal.ai.reporting.schedule.domain.exception.ScheduleNotFoundException 없거나 삭제된 경우
     */
    Schedule recordExecution(Long scheduleId, boolean succeeded);

    /**
     * 성공 기록과 다음 실행 시각 전진을 한 번의 잠금 조회와 저장으로 처리 (자동 실행 성공 시)
     */
    Schedule recordSuccessAndAdvance(Long scheduleId);
}
