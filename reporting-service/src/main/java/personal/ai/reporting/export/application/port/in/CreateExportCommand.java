package personal.ai.reporting.export.application.port.in;

/**
 * 내보내기 생성 Command
 */
public record CreateExportCommand(
        Long reportId,
        String format,
        String filePath,
        Long fileSize
) {
}
