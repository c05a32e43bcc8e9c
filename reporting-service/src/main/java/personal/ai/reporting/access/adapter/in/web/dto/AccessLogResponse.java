package personal.ai.reporting.access.adapter.in.web.dto;

import personal.ai.reporting.access.domain.model.AccessLog;

import java.time.LocalDateTime;

/**
 * 접근 기록 응답 DTO
 */
public record AccessLogResponse(
        Long id,
        Long reportId,
        Long userId,
        String accessType,
        String accessStatus,
        Integer accessDurationSeconds,
        LocalDateTime accessedAt
) {
    public static AccessLogResponse from(AccessLog accessLog) {
        return new AccessLogResponse(
                accessLog.id(),
                accessLog.reportId(),
                accessLog.userId(),
                accessLog.accessType(),
                accessLog.accessStatus(),
                accessLog.durationSeconds(),
                accessLog.accessedAt()
        );
    }
}
