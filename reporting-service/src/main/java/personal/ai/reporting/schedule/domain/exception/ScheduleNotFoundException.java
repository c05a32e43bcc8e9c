package personal.ai.reporting.schedule.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Schedule Not Found Exception
 */
public class ScheduleNotFoundException extends BusinessException {
    public ScheduleNotFoundException(Long scheduleId) {
        super(ErrorCode.SCHEDULE_NOT_FOUND,
                String.format("Schedule not found: scheduleId=%d", scheduleId));
    }
}
