package personal.ai.reporting.metric.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.metric.application.port.in.GetMetricUseCase;
import personal.ai.reporting.metric.application.port.in.RecordMetricCommand;
import personal.ai.reporting.metric.application.port.in.RecordMetricUseCase;
import personal.ai.reporting.metric.application.port.out.MetricTargetValidationPort;
import personal.ai.reporting.metric.application.port.out.ReportMetricRepository;
import personal.ai.reporting.metric.domain.model.MetricStatistics;
import personal.ai.reporting.metric.domain.model.ReportMetric;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Report Metric Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReportMetricService implements RecordMetricUseCase, GetMetricUseCase {

    private final ReportMetricRepository reportMetricRepository;
    private final MetricTargetValidationPort metricTargetValidationPort;
    private final Clock clock;

    @Override
    @Transactional
    public ReportMetric recordMetric(RecordMetricCommand command) {
        metricTargetValidationPort.validateTargetExists(command.reportId());
        return appendMetric(command);
    }

    @Override
    @Transactional
    public ReportMetric appendMetric(RecordMetricCommand command) {
        ReportMetric metric = ReportMetric.create(
                command.reportId(),
                command.name(),
                command.value(),
                command.unit(),
                command.category(),
                LocalDateTime.now(clock));

        ReportMetric saved = reportMetricRepository.save(metric);
        log.debug("Metric recorded: reportId={}, name={}, value={}, category={}",
                saved.reportId(), saved.name(), saved.value(), saved.category());
        return saved;
    }

    @Override
    public PageResponse<ReportMetric> getReportMetrics(Long reportId, int limit, int offset) {
        return reportMetricRepository.findByReportId(reportId, limit, offset);
    }

    @Override
    public PageResponse<ReportMetric> getMetricsByCategory(String category, int limit, int offset) {
        return reportMetricRepository.findByCategory(category, limit, offset);
    }

    @Override
    public MetricStatistics getAverageMetrics(String metricName, int days) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);
        return MetricStatistics.of(reportMetricRepository.findValuesByNameSince(metricName, since));
    }
}
