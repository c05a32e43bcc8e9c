package personal.ai.reporting.schedule.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.schedule.adapter.in.web.dto.CreateScheduleRequest;
import personal.ai.reporting.schedule.adapter.in.web.dto.DueSchedulesResponse;
import personal.ai.reporting.schedule.adapter.in.web.dto.ScheduleResponse;
import personal.ai.reporting.schedule.application.port.in.CreateScheduleUseCase;
import personal.ai.reporting.schedule.application.port.in.GetScheduleUseCase;
import personal.ai.reporting.schedule.application.port.in.RecordScheduleExecutionUseCase;
import personal.ai.reporting.schedule.domain.model.Schedule;

/**
 * Report Schedule API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final CreateScheduleUseCase createScheduleUseCase;
    private final GetScheduleUseCase getScheduleUseCase;
    private final RecordScheduleExecutionUseCase recordScheduleExecutionUseCase;

    /**
     * 스케줄 생성
     * POST /api/v1/schedules
     */
    @PostMapping
    public ResponseEntity<ScheduleResponse> createSchedule(@Valid @RequestBody CreateScheduleRequest request) {
        log.info("Create schedule: userId={}, templateId={}, frequency={}",
                request.userId(), request.templateId(), request.frequency());

        Schedule schedule = createScheduleUseCase.createSchedule(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleResponse.from(schedule));
    }

    /**
     * 현재 시각 기준 실행 대상 스케줄
     * GET /api/v1/schedules/due
     */
    @GetMapping("/due")
    public ResponseEntity<DueSchedulesResponse> getDueSchedules() {
        var items = getScheduleUseCase.dueSchedules().stream()
                .map(ScheduleResponse::from)
                .toList();
        return ResponseEntity.ok(DueSchedulesResponse.of(items));
    }

    /**
     * GET /api/v1/schedules/user/{userId}
     */
    @GetMapping("/user/{userId}")
    public ResponseEntity<PageResponse<ScheduleResponse>> getUserSchedules(
            @PathVariable Long userId,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<Schedule> page = getScheduleUseCase.getUserSchedules(userId, limit, offset);
        return ResponseEntity.ok(page.map(ScheduleResponse::from));
    }

    /**
     * 실행 결과 기록
     * PATCH /api/v1/schedules/{scheduleId}/execute?success=true
     */
    @PatchMapping("/{scheduleId}/execute")
    public ResponseEntity<ScheduleResponse> recordExecution(
            @PathVariable Long scheduleId,
            @RequestParam(defaultValue = "true") boolean success
    ) {
        log.info("Record schedule execution: scheduleId={}, success={}", scheduleId, success);

        Schedule schedule = recordScheduleExecutionUseCase.recordExecution(scheduleId, success);

        return ResponseEntity.ok(ScheduleResponse.from(schedule));
    }
}
