package personal.ai.reporting.export.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.export.application.port.in.CreateExportCommand;
import personal.ai.reporting.export.application.port.in.ExportUseCase;
import personal.ai.reporting.export.application.port.out.ReportExportRepository;
import personal.ai.reporting.export.domain.exception.ExportNotFoundException;
import personal.ai.reporting.export.domain.model.ReportExport;
import personal.ai.reporting.report.application.port.in.GetReportUseCase;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Report Export Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReportExportService implements ExportUseCase {

    private final ReportExportRepository reportExportRepository;
    private final GetReportUseCase getReportUseCase;
    private final Clock clock;

    @Override
    @Transactional
    public ReportExport createExport(CreateExportCommand command) {
        getReportUseCase.getReport(command.reportId(), null);

        ReportExport saved = reportExportRepository.save(ReportExport.create(
                command.reportId(), command.format(), command.filePath(), command.fileSize()));
        log.info("Export created: exportId={}, reportId={}, format={}",
                saved.id(), saved.reportId(), saved.format());
        return saved;
    }

    @Override
    @Transactional
    public ReportExport markCompleted(Long exportId, Long fileSize, String fileHash) {
        ReportExport saved = reportExportRepository.save(
                findExport(exportId).markCompleted(fileSize, fileHash, now()));
        log.info("Export completed: exportId={}, fileSize={}", exportId, saved.fileSize());
        return saved;
    }

    @Override
    @Transactional
    public ReportExport markFailed(Long exportId, String errorMessage) {
        ReportExport saved = reportExportRepository.save(findExport(exportId).markFailed(errorMessage));
        log.warn("Export failed: exportId={}, error={}", exportId, errorMessage);
        return saved;
    }

    @Override
    @Transactional
    public ReportExport recordDownload(Long exportId) {
        ReportExport saved = reportExportRepository.save(findExport(exportId).recordDownload(now()));
        log.info("Export downloaded: exportId={}, downloadCount={}", exportId, saved.downloadCount());
        return saved;
    }

    @Override
    public PageResponse<ReportExport> getReportExports(Long reportId, int limit, int offset) {
        return reportExportRepository.findByReportId(reportId, limit, offset);
    }

    private ReportExport findExport(Long exportId) {
        return reportExportRepository.findById(exportId)
                .orElseThrow(() -> {
                    log.warn("Export not found: exportId={}", exportId);
                    return new ExportNotFoundException(exportId);
                });
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
