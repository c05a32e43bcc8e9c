package personal.ai.reporting.report.application.port.in;

import personal.ai.reporting.report.domain.model.Report;

/**
 * Create Report UseCase (Input Port)
 */
public interface CreateReportUseCase {

    /**
     * @throws personal.ai.reporting.template.domain.exception.TemplateNotFoundException 템플릿이 없을 때
     */
    Report createReport(CreateReportCommand command);
}
