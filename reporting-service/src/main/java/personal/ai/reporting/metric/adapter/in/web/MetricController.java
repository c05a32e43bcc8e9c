package personal.ai.reporting.metric.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.metric.adapter.in.web.dto.MetricResponse;
import personal.ai.reporting.metric.adapter.in.web.dto.MetricStatisticsResponse;
import personal.ai.reporting.metric.adapter.in.web.dto.RecordMetricRequest;
import personal.ai.reporting.metric.application.port.in.GetMetricUseCase;
import personal.ai.reporting.metric.application.port.in.RecordMetricUseCase;
import personal.ai.reporting.metric.domain.model.ReportMetric;

/**
 * Report Metric API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
public class MetricController {

    private final RecordMetricUseCase recordMetricUseCase;
    private final GetMetricUseCase getMetricUseCase;

    /**
     * POST /api/v1/metrics
     */
    @PostMapping
    public ResponseEntity<MetricResponse> recordMetric(@Valid @RequestBody RecordMetricRequest request) {
        log.info("Record metric: reportId={}, name={}", request.reportId(), request.metricName());

        ReportMetric metric = recordMetricUseCase.recordMetric(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(MetricResponse.from(metric));
    }

    /**
     * GET /api/v1/metrics/report/{reportId}
     */
    @GetMapping("/report/{reportId}")
    public ResponseEntity<PageResponse<MetricResponse>> getReportMetrics(
            @PathVariable Long reportId,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<ReportMetric> page = getMetricUseCase.getReportMetrics(reportId, limit, offset);
        return ResponseEntity.ok(page.map(MetricResponse::from));
    }

    /**
     * GET /api/v1/metrics/category/{category}
     */
    @GetMapping("/category/{category}")
    public ResponseEntity<PageResponse<MetricResponse>> getMetricsByCategory(
            @PathVariable String category,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<ReportMetric> page = getMetricUseCase.getMetricsByCategory(category, limit, offset);
        return ResponseEntity.ok(page.map(MetricResponse::from));
    }

    /**
     * 기간 내 지표 통계
     * GET /api/v1/metrics/average/{metricName}?days=30
     */
    @GetMapping("/average/{metricName}")
    public ResponseEntity<MetricStatisticsResponse> getAverageMetrics(
            @PathVariable String metricName,
            @RequestParam(defaultValue = "30") @Min(1) @Max(365) int days
    ) {
        return ResponseEntity.ok(MetricStatisticsResponse.of(
                metricName, days, getMetricUseCase.getAverageMetrics(metricName, days)));
    }
}
