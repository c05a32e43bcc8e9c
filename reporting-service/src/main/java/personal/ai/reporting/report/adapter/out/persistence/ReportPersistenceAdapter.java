package personal.ai.reporting.report.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.report.application.port.out.ReportRepository;
import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.report.domain.model.ReportStatus;
import personal.ai.reporting.support.OffsetPageRequest;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Report Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportPersistenceAdapter implements ReportRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final JpaReportRepository jpaReportRepository;
    private final Clock clock;

    @Override
    public Report save(Report report) {
        log.debug("Saving report: reportId={}, status={}", report.id(), report.status());
        ReportEntity entity = ReportEntity.fromDomain(report);
        entity.touch(LocalDateTime.now(clock));
        return jpaReportRepository.save(entity).toDomain();
    }

    @Override
    public Optional<Report> findById(Long reportId) {
        return jpaReportRepository.findByIdAndDeletedFalse(reportId)
                .map(ReportEntity::toDomain);
    }

    @Override
    public boolean existsById(Long reportId) {
        return jpaReportRepository.existsByIdAndDeletedFalse(reportId);
    }

    @Override
    public PageResponse<Report> findByUserId(Long userId, ReportStatus status, int limit, int offset) {
        Pageable pageable = OffsetPageRequest.of(limit, offset, NEWEST_FIRST);
        Page<ReportEntity> page = status == null
                ? jpaReportRepository.findByUserIdAndDeletedFalse(userId, pageable)
                : jpaReportRepository.findByUserIdAndStatusAndDeletedFalse(userId, status, pageable);

        var items = page.getContent().stream()
                .map(ReportEntity::toDomain)
                .toList();
        return new PageResponse<>(items, page.getTotalElements(), limit, offset);
    }
}
