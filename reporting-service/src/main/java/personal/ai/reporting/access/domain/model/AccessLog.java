package personal.ai.reporting.access.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Report Access Log Domain Model
 * 보고서 조회/다운로드/공유/인쇄 감사 기록 (추가 전용)
 */
public record AccessLog(
        Long id,
        Long reportId,
        Long userId,
        String accessType,
        String accessStatus,
        String ipAddress,
        String userAgent,
        String errorMessage,
        Integer durationSeconds,
        LocalDateTime accessedAt) {

    public static final String STATUS_SUCCESS = "success";

    public AccessLog {
        if (reportId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Report ID cannot be null");
        }
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (accessType == null || accessType.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Access type cannot be null or blank");
        }
        if (durationSeconds != null && durationSeconds < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Access duration cannot be negative");
        }
        accessStatus = accessStatus == null || accessStatus.isBlank() ? STATUS_SUCCESS : accessStatus;
    }

    public boolean isSuccessful() {
        return STATUS_SUCCESS.equals(accessStatus);
    }
}
