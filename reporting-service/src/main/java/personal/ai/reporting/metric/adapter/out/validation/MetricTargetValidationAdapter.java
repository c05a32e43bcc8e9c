package personal.ai.reporting.metric.adapter.out.validation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.reporting.metric.application.port.out.MetricTargetValidationPort;
import personal.ai.reporting.metric.domain.exception.MetricTargetNotFoundException;
import personal.ai.reporting.report.application.port.out.ReportRepository;
import personal.ai.reporting.template.application.port.out.ReportTemplateRepository;

/**
 * Metric Target Validation Adapter
 * 지표 대상 ID를 보고서, 없으면 템플릿에서 확인
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricTargetValidationAdapter implements MetricTargetValidationPort {

    private final ReportRepository reportRepository;
    private final ReportTemplateRepository reportTemplateRepository;

    @Override
    public void validateTargetExists(Long reportId) {
        if (reportRepository.existsById(reportId) || reportTemplateRepository.existsById(reportId)) {
            return;
        }
        log.warn("Metric target not found: reportId={}", reportId);
        throw new MetricTargetNotFoundException(reportId);
    }
}
