package personal.ai.reporting.metric.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.metric.application.port.out.ReportMetricRepository;
import personal.ai.reporting.metric.domain.model.ReportMetric;
import personal.ai.reporting.support.OffsetPageRequest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Report Metric Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class ReportMetricPersistenceAdapter implements ReportMetricRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "recordedAt");

    private final JpaReportMetricRepository jpaReportMetricRepository;

    @Override
    public ReportMetric save(ReportMetric metric) {
        return jpaReportMetricRepository.save(ReportMetricEntity.fromDomain(metric)).toDomain();
    }

    @Override
    public PageResponse<ReportMetric> findByReportId(Long reportId, int limit, int offset) {
        return toPageResponse(jpaReportMetricRepository.findByReportIdAndDeletedFalse(
                reportId, OffsetPageRequest.of(limit, offset, NEWEST_FIRST)), limit, offset);
    }

    @Override
    public PageResponse<ReportMetric> findByCategory(String category, int limit, int offset) {
        return toPageResponse(jpaReportMetricRepository.findByCategoryAndDeletedFalse(
                category, OffsetPageRequest.of(limit, offset, NEWEST_FIRST)), limit, offset);
    }

    @Override
    public List<BigDecimal> findValuesByNameSince(String metricName, LocalDateTime since) {
        return jpaReportMetricRepository.findValuesByNameSince(metricName, since);
    }

    private PageResponse<ReportMetric> toPageResponse(Page<ReportMetricEntity> page, int limit, int offset) {
        var items = page.getContent().stream()
                .map(ReportMetricEntity::toDomain)
                .toList();
        return new PageResponse<>(items, page.getTotalElements(), limit, offset);
    }
}
