package personal.ai.reporting.schedule.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.schedule.application.port.in.CreateScheduleCommand;
import personal.ai.reporting.schedule.application.port.in.GetScheduleUseCase;
import personal.ai.reporting.schedule.application.port.in.RecordScheduleExecutionUseCase;
import personal.ai.reporting.schedule.application.port.out.ScheduleRepository;
import personal.ai.reporting.schedule.domain.exception.ScheduleNotFoundException;
import personal.ai.reporting.schedule.domain.model.DeliveryTarget;
import personal.ai.reporting.schedule.domain.model.Schedule;
import personal.ai.reporting.schedule.domain.model.TimeOfDay;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Schedule Engine
 * 스케줄 생성, 실행 대상 조회, 실행 결과에 따른 상태 전이를 담당
 * <p>
 * 현재 시각은 주입된 {@link Clock}에서만 가져옴 (UTC 기준, 스케줄의 timezone은 저장만 함)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ScheduleEngine implements GetScheduleUseCase, RecordScheduleExecutionUseCase {

    private final ScheduleRepository scheduleRepository;
    private final Clock clock;

    /**
     * 스케줄 생성
     * 템플릿 존재 여부는 호출하는 쪽(ScheduleCommandService)에서 확인
     */
    @Transactional
    public Schedule createSchedule(CreateScheduleCommand command) {
        TimeOfDay timeOfDay = TimeOfDay.parse(command.timeOfDay());
        DeliveryTarget delivery = new DeliveryTarget(
                command.deliveryMethod(),
                command.recipients(),
                command.webhookUrl(),
                command.includeFile() == null || command.includeFile());

        Schedule schedule = Schedule.create(
                command.userId(),
                command.templateId(),
                command.name(),
                command.frequency(),
                timeOfDay,
                command.dayOfWeek(),
                command.dayOfMonth(),
                command.timezone(),
                delivery,
                now());

        Schedule saved = scheduleRepository.save(schedule);
        log.info("Schedule created: scheduleId={}, userId={}, frequency={}, timeOfDay={}, nextRunAt={}",
                saved.id(), saved.userId(), saved.frequency(), saved.timeOfDay(), saved.nextRunAt());
        return saved;
    }

    @Override
    public Schedule getSchedule(Long scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    @Override
    public List<Schedule> dueSchedules() {
        return dueSchedules(now());
    }

    @Override
    public List<Schedule> dueSchedules(LocalDateTime now) {
        List<Schedule> due = scheduleRepository.findDue(now);
        log.debug("Due schedules: now={}, count={}", now, due.size());
        return due;
    }

    @Override
    public PageResponse<Schedule> getUserSchedules(Long userId, int limit, int offset) {
        return scheduleRepository.findByUserId(userId, limit, offset);
    }

    /**
     * 실행 결과 기록 (비관적 락)
     * 동시에 기록되는 결과가 카운터를 덮어쓰지 않도록 행을 잠근 상태에서 갱신
     */
    @Override
    @Transactional
    public Schedule recordExecution(Long scheduleId, boolean succeeded) {
        Schedule schedule = scheduleRepository.findByIdForUpdate(scheduleId)
                .orElseThrow(() -> {
                    log.warn("Schedule not found: scheduleId={}", scheduleId);
                    return new ScheduleNotFoundException(scheduleId);
                });

        Schedule updated = scheduleRepository.save(schedule.recordExecution(succeeded, now()));
        log.info("Schedule executed: scheduleId={}, success={}, runCount={}, nextRunAt={}",
                scheduleId, succeeded, updated.runCount(), updated.nextRunAt());
        return updated;
    }

    @Override
    @Transactional
    public Schedule recordSuccessAndAdvance(Long scheduleId) {
        Schedule schedule = scheduleRepository.findByIdForUpdate(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        LocalDateTime now = now();
        Schedule updated = scheduleRepository.save(schedule.recordExecution(true, now).advanceNextRun(now));
        log.info("Schedule executed: scheduleId={}, success=true, runCount={}, nextRunAt={}",
                scheduleId, updated.runCount(), updated.nextRunAt());
        return updated;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
