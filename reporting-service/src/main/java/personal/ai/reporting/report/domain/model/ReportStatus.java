package personal.ai.reporting.report.domain.model;

/**
 * 보고서 생성 상태
 */
public enum ReportStatus {
    DRAFT,
    GENERATING,
    READY,
    FAILED,
    ARCHIVED
}
