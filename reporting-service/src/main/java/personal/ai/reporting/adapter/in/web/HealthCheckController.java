package personal.ai.reporting.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.ai.common.dto.ApiResponse;
import personal.ai.common.dto.HealthCheckResponse;
import personal.ai.common.health.HealthCheckService;
import personal.ai.reporting.event.adapter.in.worker.EventConsumerWorker;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 데이터베이스, Redis, 이벤트 소비 워커 상태를 확인
 * <p>
 * 큐 URL이 설정되지 않아 소비가 비활성화된 경우 messageQueue는 DISABLED이며 unhealthy로 보지 않음
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    static final String DISABLED = "DISABLED";

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;
    private final EventConsumerWorker eventConsumerWorker;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        String redisStatus = healthCheckService.checkRedis();
        String queueStatus = messageQueueStatus();

        HealthCheckResponse data = new HealthCheckResponse(databaseStatus, redisStatus, queueStatus);

        boolean allHealthy = HealthCheckService.UP.equals(databaseStatus)
                && HealthCheckService.UP.equals(redisStatus)
                && !HealthCheckService.DOWN.equals(queueStatus);

        if (allHealthy) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }

    private String messageQueueStatus() {
        if (!eventConsumerWorker.isEnabled()) {
            return DISABLED;
        }
        return eventConsumerWorker.isRunning() ? HealthCheckService.UP : HealthCheckService.DOWN;
    }
}
