package personal.ai.reporting.schedule.application.port.in;

/**
 * Run Due Schedules UseCase (Input Port)
 * 실행 시각이 된 스케줄의 보고서 생성 요청을 기록
 */
public interface RunDueSchedulesUseCase {

    ScheduleRunSummary runDueSchedules();

    /**
     * @param due       실행 대상 수
     * @param processed 이번 주기에 처리한 수 (batch-size 이하)
     * @param succeeded 성공으로 기록된 수
     * @param failed    실패로 기록된 수
     * @param skipped   다른 인스턴스가 처리 중이거나 이미 처리되어 건너뛴 수
     */
    record ScheduleRunSummary(int due, int processed, int succeeded, int failed, int skipped) {
    }
}
