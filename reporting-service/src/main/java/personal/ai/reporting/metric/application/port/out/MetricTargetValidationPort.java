package personal.ai.reporting.metric.application.port.out;

/**
 * Metric Target Validation Port
 * 지표를 연결할 대상(보고서 또는 템플릿) 존재 확인
 */
public interface MetricTargetValidationPort {

    /**
     * @throws personal.ai.reporting.metric.domain.exception.MetricTargetNotFoundException 대상이 없을 때
     */
    void validateTargetExists(Long reportId);
}
