package personal.ai.reporting.template.application.port.in;

import personal.ai.reporting.template.domain.model.ReportTemplate;

/**
 * Create Template UseCase (Input Port)
 */
public interface CreateTemplateUseCase {

    /**
     * @throws personal.ai.reporting.template.domain.exception.TemplateAlreadyExistsException 이름 중복 시
     */
    ReportTemplate createTemplate(CreateTemplateCommand command);
}
