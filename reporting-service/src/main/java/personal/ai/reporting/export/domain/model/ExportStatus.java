package personal.ai.reporting.export.domain.model;

/**
 * 내보내기 파일 처리 상태
 */
public enum ExportStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
