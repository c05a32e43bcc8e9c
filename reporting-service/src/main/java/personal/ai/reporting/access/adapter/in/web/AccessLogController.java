package personal.ai.reporting.access.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.access.adapter.in.web.dto.AccessLogResponse;
import personal.ai.reporting.access.adapter.in.web.dto.LogAccessRequest;
import personal.ai.reporting.access.application.port.in.AccessLogUseCase;
import personal.ai.reporting.access.domain.model.AccessLog;
import personal.ai.reporting.access.domain.model.AccessStatistics;

/**
 * Report Access Log API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/access-logs")
@RequiredArgsConstructor
public class AccessLogController {

    private final AccessLogUseCase accessLogUseCase;

    /**
     * POST /api/v1/access-logs
     */
    @PostMapping
    public ResponseEntity<AccessLogResponse> logAccess(@Valid @RequestBody LogAccessRequest request) {
        AccessLog accessLog = accessLogUseCase.logAccess(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccessLogResponse.from(accessLog));
    }

    /**
     * GET /api/v1/access-logs/report/{reportId}
     */
    @GetMapping("/report/{reportId}")
    public ResponseEntity<PageResponse<AccessLogResponse>> getReportAccessLogs(
            @PathVariable Long reportId,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<AccessLog> page = accessLogUseCase.getReportAccessLogs(reportId, limit, offset);
        return ResponseEntity.ok(page.map(AccessLogResponse::from));
    }

    /**
     * GET /api/v1/access-logs/user/{userId}
     */
    @GetMapping("/user/{userId}")
    public ResponseEntity<PageResponse<AccessLogResponse>> getUserAccessLogs(
            @PathVariable Long userId,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<AccessLog> page = accessLogUseCase.getUserAccessLogs(userId, limit, offset);
        return ResponseEntity.ok(page.map(AccessLogResponse::from));
    }

    /**
     * 보고서 접근 통계
     * GET /api/v1/access-logs/report/{reportId}/stats
     */
    @GetMapping("/report/{reportId}/stats")
    public ResponseEntity<AccessStatistics> getAccessStatistics(@PathVariable Long reportId) {
        return ResponseEntity.ok(accessLogUseCase.getAccessStatistics(reportId));
    }
}
