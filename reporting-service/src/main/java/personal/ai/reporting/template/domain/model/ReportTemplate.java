package personal.ai.reporting.template.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Report Template Domain Model
 * 보고서 생성에 사용되는 재사용 가능한 템플릿 (불변)
 */
public record ReportTemplate(
        Long id,
        String name,
        String type,
        String description,
        List<String> sections,
        List<String> exportFormats,
        boolean defaultTemplate,
        boolean active,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public static final List<String> DEFAULT_EXPORT_FORMATS = List.of("pdf", "csv", "json");

    public ReportTemplate {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Template name cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Template type cannot be null or blank");
        }
        sections = sections == null ? List.of() : List.copyOf(sections);
        exportFormats = exportFormats == null || exportFormats.isEmpty()
                ? DEFAULT_EXPORT_FORMATS
                : List.copyOf(exportFormats);
    }

    /**
     * 템플릿 생성 (정적 팩토리 메서드)
     * 내보내기 형식 미지정 시 pdf, csv, json 사용
     */
    public static ReportTemplate create(String name, String type, String description,
                                        List<String> sections, List<String> exportFormats,
                                        boolean defaultTemplate) {
        return new ReportTemplate(null, name, type, description, sections, exportFormats,
                defaultTemplate, true, null, null);
    }
}
