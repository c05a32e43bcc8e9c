package personal.ai.reporting.export.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.export.application.port.out.ReportExportRepository;
import personal.ai.reporting.export.domain.model.ReportExport;
import personal.ai.reporting.support.OffsetPageRequest;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Report Export Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class ReportExportPersistenceAdapter implements ReportExportRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final JpaReportExportRepository jpaReportExportRepository;
    private final Clock clock;

    @Override
    public ReportExport save(ReportExport export) {
        ReportExportEntity entity = ReportExportEntity.fromDomain(export);
        entity.touch(LocalDateTime.now(clock));
        return jpaReportExportRepository.save(entity).toDomain();
    }

    @Override
    public Optional<ReportExport> findById(Long exportId) {
        return jpaReportExportRepository.findByIdAndDeletedFalse(exportId)
                .map(ReportExportEntity::toDomain);
    }

    @Override
    public PageResponse<ReportExport> findByReportId(Long reportId, int limit, int offset) {
        Page<ReportExportEntity> page = jpaReportExportRepository.findByReportIdAndDeletedFalse(
                reportId, OffsetPageRequest.of(limit, offset, NEWEST_FIRST));
        var items = page.getContent().stream()
                .map(ReportExportEntity::toDomain)
                .toList();
        return new PageResponse<>(items, page.getTotalElements(), limit, offset);
    }
}
