package personal.ai.reporting.report.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.report.application.port.in.CreateReportCommand;
import personal.ai.reporting.report.application.port.in.CreateReportUseCase;
import personal.ai.reporting.report.application.port.in.GetReportUseCase;
import personal.ai.reporting.report.application.port.in.UpdateReportStatusUseCase;
import personal.ai.reporting.report.application.port.out.ReportRepository;
import personal.ai.reporting.report.domain.exception.ReportNotFoundException;
import personal.ai.reporting.report.domain.model.Report;
import personal.ai.reporting.report.domain.model.ReportStatus;
import personal.ai.reporting.template.application.port.in.GetTemplateUseCase;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Report Application Service
 * 보고서 생성 요청 기록과 생성 진행 상태 관리
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReportService implements CreateReportUseCase, GetReportUseCase, UpdateReportStatusUseCase {

    private final ReportRepository reportRepository;
    private final GetTemplateUseCase getTemplateUseCase;
    private final Clock clock;

    @Override
    @Transactional
    public Report createReport(CreateReportCommand command) {
        // 템플릿 존재 확인 (없으면 TemplateNotFoundException)
        getTemplateUseCase.getTemplate(command.templateId());

        Report report = Report.create(
                command.userId(),
                command.templateId(),
                command.name(),
                command.type(),
                command.dateRangeStart(),
                command.dateRangeEnd(),
                command.filters(),
                command.generatedBy());

        Report saved = reportRepository.save(report);
        log.info("Report created: reportId={}, userId={}, templateId={}, generatedBy={}",
                saved.id(), saved.userId(), saved.templateId(), saved.generatedBy());
        return saved;
    }

    @Override
    public Report getReport(Long reportId, Long userId) {
        Report report = findReport(reportId);
        if (userId != null && !report.isOwnedBy(userId)) {
            log.warn("Report owner mismatch: reportId={}, userId={}", reportId, userId);
            throw new ReportNotFoundException(reportId);
        }
        return report;
    }

    @Override
    public PageResponse<Report> getUserReports(Long userId, ReportStatus status, int limit, int offset) {
        log.debug("Get user reports: userId={}, status={}, limit={}, offset={}", userId, status, limit, offset);
        return reportRepository.findByUserId(userId, status, limit, offset);
    }

    @Override
    @Transactional
    public Report updateStatus(Long reportId, ReportStatus status, int progressPercent, int rowsGenerated) {
        Report updated = reportRepository.save(
                findReport(reportId).updateStatus(status, progressPercent, rowsGenerated));
        log.info("Report status updated: reportId={}, status={}, progress={}",
                reportId, status, progressPercent);
        return updated;
    }

    @Override
    @Transactional
    public Report markCompleted(Long reportId, int totalRecords, double generationTimeSeconds,
                                String filePath, Long fileSize) {
        Report completed = findReport(reportId).markCompleted(
                totalRecords, generationTimeSeconds, filePath, fileSize, LocalDateTime.now(clock));
        Report saved = reportRepository.save(completed);
        log.info("Report completed: reportId={}, totalRecords={}, generationTime={}s",
                reportId, totalRecords, generationTimeSeconds);
        return saved;
    }

    @Override
    @Transactional
    public Report markFailed(Long reportId, String errorMessage) {
        Report saved = reportRepository.save(findReport(reportId).markFailed(errorMessage));
        log.warn("Report failed: reportId={}, error={}", reportId, errorMessage);
        return saved;
    }

    private Report findReport(Long reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> {
                    log.warn("Report not found: reportId={}", reportId);
                    return new ReportNotFoundException(reportId);
                });
    }
}
