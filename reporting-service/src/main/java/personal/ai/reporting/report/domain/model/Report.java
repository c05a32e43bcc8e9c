package personal.ai.reporting.report.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Report Domain Model
 * 보고서 생성 상태와 결과 파일 정보를 추적 (불변)
 */
public record Report(
        Long id,
        Long userId,
        Long templateId,
        String name,
        String type,
        LocalDateTime dateRangeStart,
        LocalDateTime dateRangeEnd,
        ReportStatus status,
        int progressPercent,
        int totalRecords,
        int rowsGenerated,
        LocalDateTime generatedAt,
        GenerationSource generatedBy,
        String filePath,
        Long fileSize,
        Map<String, Object> filters,
        String errorMessage,
        Double generationTimeSeconds,
        LocalDateTime createdAt) {

    public Report {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (templateId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Template ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Report name cannot be null or blank");
        }
        if (dateRangeStart == null || dateRangeEnd == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Report date range cannot be null");
        }
        if (dateRangeEnd.isBefore(dateRangeStart)) {
            throw new BusinessException(ErrorCode.INVALID_DATE_RANGE,
                    String.format("Date range end %s is before start %s", dateRangeEnd, dateRangeStart));
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Report status cannot be null");
        }
        if (progressPercent < 0 || progressPercent > 100) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Progress percent must be between 0 and 100: " + progressPercent);
        }
        // JSON 필터 값에 null이 포함될 수 있어 Map.copyOf 대신 사용
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    /**
     * 보고서 생성 (정적 팩토리 메서드)
     *
     * @return 새로운 보고서 (DRAFT 상태, 진행률 0)
     */
    public static Report create(Long userId, Long templateId, String name, String type,
                                LocalDateTime dateRangeStart, LocalDateTime dateRangeEnd,
                                Map<String, Object> filters, GenerationSource generatedBy) {
        return new Report(null, userId, templateId, name, type, dateRangeStart, dateRangeEnd,
                ReportStatus.DRAFT, 0, 0, 0, null,
                generatedBy == null ? GenerationSource.MANUAL : generatedBy,
                null, null, filters, null, null, null);
    }

    /**
     * 진행 상태 갱신
     */
    public Report updateStatus(ReportStatus newStatus, int newProgressPercent, int newRowsGenerated) {
        return new Report(id, userId, templateId, name, type, dateRangeStart, dateRangeEnd,
                newStatus, newProgressPercent, totalRecords, newRowsGenerated, generatedAt, generatedBy,
                filePath, fileSize, filters, errorMessage, generationTimeSeconds, createdAt);
    }

    /**
     * 생성 완료 (-> READY)
     * 파일 정보는 값이 주어진 경우에만 덮어씀
     */
    public Report markCompleted(int newTotalRecords, double generationTime, String newFilePath,
                                Long newFileSize, LocalDateTime completedAt) {
        return new Report(id, userId, templateId, name, type, dateRangeStart, dateRangeEnd,
                ReportStatus.READY, 100, newTotalRecords, newTotalRecords, completedAt, generatedBy,
                newFilePath != null ? newFilePath : filePath,
                newFileSize != null ? newFileSize : fileSize,
                filters, errorMessage, generationTime, createdAt);
    }

    /**
     * 생성 실패 (-> FAILED)
     */
    public Report markFailed(String reason) {
        return new Report(id, userId, templateId, name, type, dateRangeStart, dateRangeEnd,
                ReportStatus.FAILED, progressPercent, totalRecords, rowsGenerated, generatedAt, generatedBy,
                filePath, fileSize, filters, reason, generationTimeSeconds, createdAt);
    }

    public boolean isOwnedBy(Long requestUserId) {
        return userId.equals(requestUserId);
    }
}
