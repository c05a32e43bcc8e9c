package personal.ai.reporting.template.application.port.in;

import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.util.Optional;

/**
 * Get Template UseCase (Input Port)
 * 템플릿 조회 유스케이스 (삭제된 템플릿은 조회되지 않음)
 */
public interface GetTemplateUseCase {

    /**
     * @throws personal.ai.reporting.template.domain.exception.TemplateNotFoundException 템플릿이 없을 때
     */
    ReportTemplate getTemplate(Long templateId);

    PageResponse<ReportTemplate> getTemplatesByType(String type, int limit, int offset);

    PageResponse<ReportTemplate> listActiveTemplates(int limit, int offset);

    /**
     * 이름으로 템플릿 조회
     * 이벤트 메트릭의 기준(anchor) 템플릿 조회에 사용
     */
    Optional<ReportTemplate> findTemplateByName(String name);
}
