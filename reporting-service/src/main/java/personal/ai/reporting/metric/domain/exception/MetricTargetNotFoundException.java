package personal.ai.reporting.metric.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 지표를 연결할 보고서/템플릿이 없을 때
 */
public class MetricTargetNotFoundException extends BusinessException {
    public MetricTargetNotFoundException(Long reportId) {
        super(ErrorCode.NOT_FOUND,
                String.format("Metric target not found: reportId=%d", reportId));
    }
}
