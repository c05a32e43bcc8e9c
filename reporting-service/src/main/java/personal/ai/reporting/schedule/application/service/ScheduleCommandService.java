package personal.ai.reporting.schedule.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.reporting.schedule.application.port.in.CreateScheduleCommand;
import personal.ai.reporting.schedule.application.port.in.CreateScheduleUseCase;
import personal.ai.reporting.schedule.domain.model.Schedule;
import personal.ai.reporting.template.application.port.in.GetTemplateUseCase;

/**
 * Schedule Command Service
 * 템플릿 존재 확인 후 스케줄 엔진에 생성을 위임
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleCommandService implements CreateScheduleUseCase {

    private final GetTemplateUseCase getTemplateUseCase;
    private final ScheduleEngine scheduleEngine;

    @Override
    @Transactional
    public Schedule createSchedule(CreateScheduleCommand command) {
        getTemplateUseCase.getTemplate(command.templateId());
        return scheduleEngine.createSchedule(command);
    }
}
