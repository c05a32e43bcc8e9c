package personal.ai.reporting.report.domain.model;

/**
 * 보고서 생성 주체
 */
public enum GenerationSource {
    MANUAL,
    SCHEDULED,
    SYSTEM
}
