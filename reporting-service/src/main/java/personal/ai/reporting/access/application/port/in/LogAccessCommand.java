package personal.ai.reporting.access.application.port.in;

/**
 * 접근 기록 Command
 */
public record LogAccessCommand(
        Long reportId,
        Long userId,
        String accessType,
        String accessStatus,
        String ipAddress,
        String userAgent,
        String errorMessage,
        Integer durationSeconds
) {
}
