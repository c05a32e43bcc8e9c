package personal.ai.reporting.metric.application.port.in;

import personal.ai.reporting.metric.domain.model.ReportMetric;

/**
 * Record Metric UseCase (Input Port)
 */
public interface RecordMetricUseCase {

    /**
     * 대상 보고서 또는 템플릿이 존재하는지 확인한 뒤 기록
     *
     * @throws personal.ai.reporting.metric.domain.exception.MetricTargetNotFoundException 대상이 없을 때
     */
    ReportMetric recordMetric(RecordMetricCommand command);

    /**
     * 대상 확인 없이 기록 (대상을 이미 조회한 호출자용)
     */
    ReportMetric appendMetric(RecordMetricCommand command);
}
