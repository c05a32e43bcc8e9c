package personal.ai.common.dto;

/**
 * Health Check 응답 데이터
 *
 * @param database     데이터베이스 상태 ("UP" 또는 "DOWN")
 * @param redis        Redis 상태 ("UP" 또는 "DOWN")
 * @param messageQueue 이벤트 큐 상태 ("UP", "DOWN" 또는 "DISABLED")
 */
public record HealthCheckResponse(
        String database,
        String redis,
        String messageQueue
) {
}
