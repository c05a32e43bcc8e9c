package personal.ai.reporting.schedule.application.port.in;

import personal.ai.reporting.schedule.domain.model.Schedule;

/**
 * Create Schedule UseCase (Input Port)
 */
public interface CreateScheduleUseCase {

    /**
     * @throws personal.ai.reporting.template.domain.exception.TemplateNotFoundException 템플릿이 없거나 삭제된 경우
     * @throws personal.ai.common.exception.BusinessException                            INVALID_TIME_OF_DAY
     */
    Schedule createSchedule(CreateScheduleCommand command);
}
