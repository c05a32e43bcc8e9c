package personal.ai.reporting.access.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.access.application.port.out.AccessLogRepository;
import personal.ai.reporting.access.domain.model.AccessLog;
import personal.ai.reporting.support.OffsetPageRequest;

import java.util.List;

/**
 * Access Log Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class AccessLogPersistenceAdapter implements AccessLogRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "accessedAt");

    private final JpaAccessLogRepository jpaAccessLogRepository;

    @Override
    public AccessLog save(AccessLog accessLog) {
        return jpaAccessLogRepository.save(AccessLogEntity.fromDomain(accessLog)).toDomain();
    }

    @Override
    public PageResponse<AccessLog> findByReportId(Long reportId, int limit, int offset) {
        return toPageResponse(jpaAccessLogRepository.findByReportIdAndDeletedFalse(
                reportId, OffsetPageRequest.of(limit, offset, NEWEST_FIRST)), limit, offset);
    }

    @Override
    public PageResponse<AccessLog> findByUserId(Long userId, int limit, int offset) {
        return toPageResponse(jpaAccessLogRepository.findByUserIdAndDeletedFalse(
                userId, OffsetPageRequest.of(limit, offset, NEWEST_FIRST)), limit, offset);
    }

    @Override
    public List<AccessLog> findAllByReportId(Long reportId) {
        return jpaAccessLogRepository.findByReportIdAndDeletedFalse(reportId).stream()
                .map(AccessLogEntity::toDomain)
                .toList();
    }

    private PageResponse<AccessLog> toPageResponse(Page<AccessLogEntity> page, int limit, int offset) {
        var items = page.getContent().stream()
                .map(AccessLogEntity::toDomain)
                .toList();
        return new PageResponse<>(items, page.getTotalElements(), limit, offset);
    }
}
