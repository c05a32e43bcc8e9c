package personal.ai.reporting.report.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.report.adapter.in.web.dto.CreateReportRequest;
import personal.ai.reporting.report.adapter.in.web.dto.ReportResponse;
import personal.ai.reporting.report.adapter.in.web.dto.UpdateReportStatusRequest;
import personal.ai.reporting.report.application.port.in.CreateReportUseCase;
import personal.ai.reporting.report.application.port.in.GetReportUseCase;
import personal.ai.reporting.report.application.port.in.UpdateReportStatusUseCase;
import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.report.domain.model.ReportStatus;

/**
 * Report API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportController {

    private final CreateReportUseCase createReportUseCase;
    private final GetReportUseCase getReportUseCase;
    private final UpdateReportStatusUseCase updateReportStatusUseCase;

    /**
     * 보고서 생성 요청
     * POST /api/v1/reports
     */
    @PostMapping
    public ResponseEntity<ReportResponse> createReport(@Valid @RequestBody CreateReportRequest request) {
        log.info("Create report: userId={}, templateId={}", request.userId(), request.templateId());

        Report report = createReportUseCase.createReport(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(ReportResponse.from(report));
    }

    /**
     * GET /api/v1/reports/{reportId}?userId=
     */
    @GetMapping("/{reportId}")
    public ResponseEntity<ReportResponse> getReport(
            @PathVariable Long reportId,
            @RequestParam(required = false) Long userId
    ) {
        return ResponseEntity.ok(ReportResponse.from(getReportUseCase.getReport(reportId, userId)));
    }

    /**
     * 사용자별 보고서 목록
     * GET /api/v1/reports/user/{userId}?status=
     */
    @GetMapping("/user/{userId}")
    public ResponseEntity<PageResponse<ReportResponse>> getUserReports(
            @PathVariable Long userId,
            @RequestParam(required = false) ReportStatus status,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<Report> page = getReportUseCase.getUserReports(userId, status, limit, offset);
        return ResponseEntity.ok(page.map(ReportResponse::from));
    }

    /**
     * 생성 진행 상태 갱신
     * PATCH /api/v1/reports/{reportId}/status
     */
    @PatchMapping("/{reportId}/status")
    public ResponseEntity<ReportResponse> updateStatus(
            @PathVariable Long reportId,
            @Valid @RequestBody UpdateReportStatusRequest request
    ) {
        log.info("Update report status: reportId={}, status={}", reportId, request.status());

        Report report = updateReportStatusUseCase.updateStatus(
                reportId, request.status(), request.progressPercent(), request.rowsGenerated());

        return ResponseEntity.ok(ReportResponse.from(report));
    }
}
