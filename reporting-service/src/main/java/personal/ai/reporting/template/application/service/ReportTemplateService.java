package personal.ai.reporting.template.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.template.application.port.in.CreateTemplateCommand;
import personal.ai.reporting.template.application.port.in.CreateTemplateUseCase;
import personal.ai.reporting.template.application.port.in.GetTemplateUseCase;
import personal.ai.reporting.template.application.port.out.ReportTemplateRepository;
import personal.ai.reporting.template.domain.exception.TemplateAlreadyExistsException;
import personal.ai.reporting.template.domain.exception.TemplateNotFoundException;
import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.util.Optional;

/**
 * Report Template Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReportTemplateService implements CreateTemplateUseCase, GetTemplateUseCase {

    private final ReportTemplateRepository reportTemplateRepository;

    @Override
    @Transactional
    public ReportTemplate createTemplate(CreateTemplateCommand command) {
        if (reportTemplateRepository.existsByName(command.name())) {
            log.warn("Duplicate template name: name={}", command.name());
            throw new TemplateAlreadyExistsException(command.name());
        }

        ReportTemplate template = ReportTemplate.create(
                command.name(),
                command.type(),
                command.description(),
                command.sections(),
                command.exportFormats(),
                command.defaultTemplate());

        ReportTemplate saved = reportTemplateRepository.save(template);
        log.info("Template created: templateId={}, name={}, type={}", saved.id(), saved.name(), saved.type());
        return saved;
    }

    @Override
    public ReportTemplate getTemplate(Long templateId) {
        return reportTemplateRepository.findById(templateId)
                .orElseThrow(() -> {
                    log.warn("Template not found: templateId={}", templateId);
                    return new TemplateNotFoundException(templateId);
                });
    }

    @Override
    public PageResponse<ReportTemplate> getTemplatesByType(String type, int limit, int offset) {
        return reportTemplateRepository.findByType(type, limit, offset);
    }

    @Override
    public PageResponse<ReportTemplate> listActiveTemplates(int limit, int offset) {
        return reportTemplateRepository.findActive(limit, offset);
    }

    @Override
    public Optional<ReportTemplate> findTemplateByName(String name) {
        return reportTemplateRepository.findByName(name);
    }
}
