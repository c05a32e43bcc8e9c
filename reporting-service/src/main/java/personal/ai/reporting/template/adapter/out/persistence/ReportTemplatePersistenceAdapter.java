package personal.ai.reporting.template.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.support.OffsetPageRequest;
import personal.ai.reporting.template.application.port.out.ReportTemplateRepository;
import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Report Template Persistence Adapter
 * JPA를 사용한 템플릿 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportTemplatePersistenceAdapter implements ReportTemplateRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final JpaReportTemplateRepository jpaReportTemplateRepository;
    private final Clock clock;

    @Override
    public ReportTemplate save(ReportTemplate template) {
        log.debug("Saving template: name={}", template.name());
        ReportTemplateEntity entity = ReportTemplateEntity.fromDomain(template);
        entity.touch(LocalDateTime.now(clock));
        var saved = jpaReportTemplateRepository.save(entity);
        return saved.toDomain();
    }

    @Override
    public Optional<ReportTemplate> findById(Long templateId) {
        return jpaReportTemplateRepository.findByIdAndDeletedFalse(templateId)
                .map(ReportTemplateEntity::toDomain);
    }

    @Override
    public Optional<ReportTemplate> findByName(String name) {
        return jpaReportTemplateRepository.findByNameAndDeletedFalse(name)
                .map(ReportTemplateEntity::toDomain);
    }

    @Override
    public boolean existsById(Long templateId) {
        return jpaReportTemplateRepository.existsByIdAndDeletedFalse(templateId);
    }

    @Override
    public boolean existsByName(String name) {
        return jpaReportTemplateRepository.existsByName(name);
    }

    @Override
    public PageResponse<ReportTemplate> findByType(String type, int limit, int offset) {
        Page<ReportTemplateEntity> page = jpaReportTemplateRepository.findByTypeAndDeletedFalse(
                type, OffsetPageRequest.of(limit, offset, NEWEST_FIRST));
        return toPageResponse(page, limit, offset);
    }

    @Override
    public PageResponse<ReportTemplate> findActive(int limit, int offset) {
        Page<ReportTemplateEntity> page = jpaReportTemplateRepository.findByActiveTrueAndDeletedFalse(
                OffsetPageRequest.of(limit, offset, NEWEST_FIRST));
        return toPageResponse(page, limit, offset);
    }

    private PageResponse<ReportTemplate> toPageResponse(Page<ReportTemplateEntity> page, int limit, int offset) {
        var items = page.getContent().stream()
                .map(ReportTemplateEntity::toDomain)
                .toList();
        return new PageResponse<>(items, page.getTotalElements(), limit, offset);
    }
}
