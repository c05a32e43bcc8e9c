package personal.ai.reporting.template.adapter.in.web.dto;

import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 템플릿 조회/생성 응답 DTO
 */
public record TemplateResponse(
        Long id,
        String templateName,
        String templateType,
        String description,
        List<String> sections,
        List<String> exportFormats,
        boolean isDefault,
        boolean isActive,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static TemplateResponse from(ReportTemplate template) {
        return new TemplateResponse(
                template.id(),
                template.name(),
                template.type(),
                template.description(),
                template.sections(),
                template.exportFormats(),
                template.defaultTemplate(),
                template.active(),
                template.createdAt(),
                template.updatedAt()
        );
    }
}
