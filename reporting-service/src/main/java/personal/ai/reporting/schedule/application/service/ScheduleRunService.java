package personal.ai.reporting.schedule.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import personal.ai.reporting.report.application.port.in.CreateReportCommand;
import personal.ai.reporting.report.application.port.in.CreateReportUseCase;
import personal.ai.reporting.report.domain.model.GenerationSource;
import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.schedule.application.config.ScheduleTriggerProperties;
import personal.ai.reporting.schedule.application.port.in.GetScheduleUseCase;
import personal.ai.reporting.schedule.application.port.in.RecordScheduleExecutionUseCase;
import personal.ai.reporting.schedule.application.port.in.RunDueSchedulesUseCase;
import personal.ai.reporting.schedule.application.port.out.SchedulerLockPort;
import personal.ai.reporting.schedule.domain.model.Schedule;
import personal.ai.reporting.template.application.port.in.GetTemplateUseCase;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Schedule Run Service
 * 실행 시각이 된 스케줄마다 SCHEDULED 보고서(DRAFT)를 기록하고 전달 의도를 로그로 남긴 뒤 실행 결과를 기록
 * <p>
 * 보고서 기록, 성공 기록, 다음 실행 시각 전진은 하나의 트랜잭션으로 처리
 * 그중 하나라도 실패하면 전부 롤백하고 별도 트랜잭션에서 실패로 기록 (엔진이 다음 실행 시각을 재계산)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleRunService implements RunDueSchedulesUseCase {

    static final String SCHEDULER_NAME = "schedule-run";
    private static final String RUNS_METRIC = "reporting.schedule.runs";

    private final GetScheduleUseCase getScheduleUseCase;
    private final RecordScheduleExecutionUseCase recordScheduleExecutionUseCase;
    private final CreateReportUseCase createReportUseCase;
    private final GetTemplateUseCase getTemplateUseCase;
    private final SchedulerLockPort schedulerLockPort;
    private final TransactionTemplate transactionTemplate;
    private final ScheduleTriggerProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public ScheduleRunSummary runDueSchedules() {
        List<Schedule> due = getScheduleUseCase.dueSchedules();
        if (due.isEmpty()) {
            log.debug("No due schedules");
            return new ScheduleRunSummary(0, 0, 0, 0, 0);
        }

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;

        List<Schedule> batch = due.stream().limit(properties.batchSize()).toList();
        for (Schedule schedule : batch) {
            String resourceId = String.valueOf(schedule.id());
            if (!schedulerLockPort.tryAcquire(SCHEDULER_NAME, resourceId)) {
                log.debug("Skipping scheduleId={} (another instance is processing)", schedule.id());
                increment("skipped");
                skipped++;
                continue;
            }

            try {
                switch (runSchedule(schedule.id())) {
                    case SUCCEEDED -> succeeded++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                }
            } catch (Exception e) {
                log.error("Failed to run schedule: scheduleId={}", schedule.id(), e);
                increment("error");
                failed++;
            } finally {
                schedulerLockPort.release(SCHEDULER_NAME, resourceId);
            }
        }

        log.info("Schedule run completed: due={}, processed={}, succeeded={}, failed={}, skipped={}, lockStrategy={}",
                due.size(), batch.size(), succeeded, failed, skipped, schedulerLockPort.getStrategyName());
        return new ScheduleRunSummary(due.size(), batch.size(), succeeded, failed, skipped);
    }

    private RunOutcome runSchedule(Long scheduleId) {
        // 락 획득 전에 다른 인스턴스가 이미 처리했을 수 있으므로 다시 확인
        Schedule schedule = getScheduleUseCase.getSchedule(scheduleId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (!schedule.isDue(now)) {
            log.debug("Schedule no longer due: scheduleId={}, nextRunAt={}", scheduleId, schedule.nextRunAt());
            increment("skipped");
            return RunOutcome.SKIPPED;
        }

        Report report;
        try {
            report = transactionTemplate.execute(status -> {
                Report created = createReportUseCase.createReport(toReportCommand(schedule, now));
                recordScheduleExecutionUseCase.recordSuccessAndAdvance(scheduleId);
                return created;
            });
        } catch (Exception e) {
            log.error("Scheduled run rolled back: scheduleId={}", scheduleId, e);
            recordScheduleExecutionUseCase.recordExecution(scheduleId, false);
            increment("failed");
            return RunOutcome.FAILED;
        }

        log.info("Scheduled report delivery requested: scheduleId={}, reportId={}, method={}, recipients={}, includeFile={}",
                scheduleId, report.id(), schedule.delivery().method(), schedule.delivery().recipients().size(),
                schedule.delivery().includeFile());
        increment("succeeded");
        return RunOutcome.SUCCEEDED;
    }

    private CreateReportCommand toReportCommand(Schedule schedule, LocalDateTime now) {
        String reportType = getTemplateUseCase.getTemplate(schedule.templateId()).type();
        LocalDateTime rangeStart = schedule.lastRunAt() != null ? schedule.lastRunAt() : schedule.createdAt();
        if (rangeStart == null) {
            rangeStart = now;
        }

        return new CreateReportCommand(
                schedule.userId(),
                schedule.templateId(),
                schedule.name() + " " + now.toLocalDate(),
                reportType,
                rangeStart,
                now,
                Map.of("scheduleId", schedule.id()),
                GenerationSource.SCHEDULED);
    }

    private void increment(String outcome) {
        Counter.builder(RUNS_METRIC)
                .tag("outcome", outcome)
                .description("Number of schedule runs by outcome")
                .register(meterRegistry)
                .increment();
    }

    private enum RunOutcome {
        SUCCEEDED, FAILED, SKIPPED
    }
}
