package personal.ai.reporting.report.application.port.in;

import personal.ai.reporting.report.domain.model.GenerationSource;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 보고서 생성 Command
 */
public record CreateReportCommand(
        Long userId,
        Long templateId,
        String name,
        String type,
        LocalDateTime dateRangeStart,
        LocalDateTime dateRangeEnd,
        Map<String, Object> filters,
        GenerationSource generatedBy
) {
}
