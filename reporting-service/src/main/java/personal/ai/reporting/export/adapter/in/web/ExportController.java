package personal.ai.reporting.export.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.export.adapter.in.web.dto.CompleteExportRequest;
import personal.ai.reporting.export.adapter.in.web.dto.CreateExportRequest;
import personal.ai.reporting.export.adapter.in.web.dto.ExportResponse;
import personal.ai.reporting.export.adapter.in.web.dto.FailExportRequest;
import personal.ai.reporting.export.application.port.in.ExportUseCase;
import personal.ai.reporting.export.domain.model.ReportExport;

/**
 * Report Export API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/exports")
@RequiredArgsConstructor
public class ExportController {

    private final ExportUseCase exportUseCase;

    /**
     * POST /api/v1/exports
     */
    @PostMapping
    public ResponseEntity<ExportResponse> createExport(@Valid @RequestBody CreateExportRequest request) {
        log.info("Create export: reportId={}, format={}", request.reportId(), request.exportFormat());

        ReportExport export = exportUseCase.createExport(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(ExportResponse.from(export));
    }

    /**
     * GET /api/v1/exports/report/{reportId}
     */
    @GetMapping("/report/{reportId}")
    public ResponseEntity<PageResponse<ExportResponse>> getReportExports(
            @PathVariable Long reportId,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset
    ) {
        PageResponse<ReportExport> page = exportUseCase.getReportExports(reportId, limit, offset);
        return ResponseEntity.ok(page.map(ExportResponse::from));
    }

    /**
     * 다운로드 기록
     * PATCH /api/v1/exports/{exportId}/download
     */
    @PatchMapping("/{exportId}/download")
    public ResponseEntity<ExportResponse> recordDownload(@PathVariable Long exportId) {
        return ResponseEntity.ok(ExportResponse.from(exportUseCase.recordDownload(exportId)));
    }

    /**
     * PATCH /api/v1/exports/{exportId}/complete
     */
    @PatchMapping("/{exportId}/complete")
    public ResponseEntity<ExportResponse> markCompleted(
            @PathVariable Long exportId,
            @Valid @RequestBody CompleteExportRequest request
    ) {
        ReportExport export = exportUseCase.markCompleted(exportId, request.fileSize(), request.fileHash());
        return ResponseEntity.ok(ExportResponse.from(export));
    }

    /**
     * PATCH /api/v1/exports/{exportId}/fail
     */
    @PatchMapping("/{exportId}/fail")
    public ResponseEntity<ExportResponse> markFailed(
            @PathVariable Long exportId,
            @Valid @RequestBody FailExportRequest request
    ) {
        return ResponseEntity.ok(ExportResponse.from(exportUseCase.markFailed(exportId, request.errorMessage())));
    }
}
