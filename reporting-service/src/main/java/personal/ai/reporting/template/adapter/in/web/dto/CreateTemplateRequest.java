package personal.ai.reporting.template.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.ai.reporting.template.application.port.in.CreateTemplateCommand;

import java.util.List;

/**
 * 템플릿 생성 요청 DTO
 */
public record CreateTemplateRequest(
        @NotBlank(message = "템플릿 이름은 필수입니다.")
        @Size(max = 100, message = "템플릿 이름은 100자 이하여야 합니다.")
        String templateName,

        @NotBlank(message = "템플릿 유형은 필수입니다.")
        @Size(max = 50, message = "템플릿 유형은 50자 이하여야 합니다.")
        String templateType,

        String description,
        List<String> sections,
        List<String> exportFormats,
        Boolean isDefault
) {
    public CreateTemplateCommand toCommand() {
        return new CreateTemplateCommand(templateName, templateType, description, sections, exportFormats,
                Boolean.TRUE.equals(isDefault));
    }
}
