package personal.ai.reporting.template.application.port.in;

import java.util.List;

/**
 * 템플릿 생성 Command
 */
public record CreateTemplateCommand(
        String name,
        String type,
        String description,
        List<String> sections,
        List<String> exportFormats,
        boolean defaultTemplate
) {
}
