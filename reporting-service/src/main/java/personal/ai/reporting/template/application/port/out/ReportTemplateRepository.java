package personal.ai.reporting.template.application.port.out;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.util.Optional;

/**
 * Report Template Repository (Output Port)
 * 모든 조회는 soft delete된 행을 제외
 */
public interface ReportTemplateRepository {

    ReportTemplate save(ReportTemplate template);

    Optional<ReportTemplate> findById(Long templateId);

    Optional<ReportTemplate> findByName(String name);

    boolean existsById(Long templateId);

    boolean existsByName(String name);

    PageResponse<ReportTemplate> findByType(String type, int limit, int offset);

    PageResponse<ReportTemplate> findActive(int limit, int offset);
}
