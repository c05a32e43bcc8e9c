package personal.ai.reporting.schedule.adapter.in.web.dto;

import java.util.List;

/**
 * 실행 대상 스케줄 목록 응답
 */
public record DueSchedulesResponse(
        List<ScheduleResponse> items,
        int count
) {
    public static DueSchedulesResponse of(List<ScheduleResponse> items) {
        return new DueSchedulesResponse(items, items.size());
    }
}
