package personal.ai.reporting.schedule.adapter.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.ai.reporting.schedule.application.port.in.RunDueSchedulesUseCase;

/**
 * Schedule Execution Scheduler
 * 주기적으로 실행 시각이 된 스케줄을 처리
 * 주기: reporting.schedule.trigger.interval-ms (기본 60초)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reporting.schedule.trigger.enabled", havingValue = "true")
public class ScheduleExecutionScheduler {

    private final RunDueSchedulesUseCase runDueSchedulesUseCase;

    @Scheduled(fixedDelayString = "${reporting.schedule.trigger.interval-ms:60000}")
    public void runDueSchedules() {
        try {
            RunDueSchedulesUseCase.ScheduleRunSummary summary = runDueSchedulesUseCase.runDueSchedules();
            if (summary.due() > 0) {
                log.debug("Schedule trigger tick: {}", summary);
            }
        } catch (Exception e) {
            // 다음 주기에 다시 시도
            log.error("Schedule trigger failed", e);
        }
    }
}
