package personal.ai.reporting.export.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.reporting.export.application.port.in.CreateExportCommand;
import personal.ai.reporting.export.application.port.out.ReportExportRepository;
import personal.ai.reporting.export.domain.exception.ExportNotFoundException;
import personal.ai.reporting.export.domain.model.ExportStatus;
import personal.ai.reporting.export.domain.model.ReportExport;
import personal.ai.reporting.report.application.port.in.GetReportUseCase;
import personal.ai.reporting.report.domain.exception.ReportNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReportExportService 단위 테스트")
class ReportExportServiceTest {

    private static final Long REPORT_ID = 100L;
    private static final Long EXPORT_ID = 5L;
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 2, 1, 9, 30);

    @Mock
    private ReportExportRepository reportExportRepository;
    @Mock
    private GetReportUseCase getReportUseCase;

    private ReportExportService reportExportService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-02-01T09:30:00Z"), ZoneOffset.UTC);
        reportExportService = new ReportExportService(reportExportRepository, getReportUseCase, clock);
    }

    private ReportExport pendingExport() {
        return new ReportExport(EXPORT_ID, REPORT_ID, "pdf", "/exports/100.pdf", 1024L, null,
                ExportStatus.PENDING, null, 0, null, null, null, NOW.minusHours(1));
    }

    private void saveReturnsArgument() {
        willAnswer(invocation -> invocation.getArgument(0))
                .given(reportExportRepository).save(any(ReportExport.class));
    }

    @Test
    @DisplayName("내보내기 생성 - PENDING 상태")
    void createExport_Pending() {
        // given
        saveReturnsArgument();

        // when
        ReportExport export = reportExportService.createExport(
                new CreateExportCommand(REPORT_ID, "csv", "/exports/100.csv", null));

        // then
        assertThat(export.status()).isEqualTo(ExportStatus.PENDING);
        assertThat(export.downloadCount()).isZero();
        verify(getReportUseCase).getReport(REPORT_ID, null);
    }

    @Test
    @DisplayName("내보내기 생성 실패 - 보고서 없음")
    void createExport_ReportNotFound() {
        // given
        given(getReportUseCase.getReport(REPORT_ID, null)).willThrow(new ReportNotFoundException(REPORT_ID));

        // when & then
        assertThatThrownBy(() -> reportExportService.createExport(
                new CreateExportCommand(REPORT_ID, "csv", "/exports/100.csv", null)))
                .isInstanceOf(ReportNotFoundException.class);
        verify(reportExportRepository, never()).save(any());
    }

    @Test
    @DisplayName("내보내기 완료 - 해시 기록, 파일 크기 미지정 시 기존 값 유지")
    void markCompleted() {
        // given
        given(reportExportRepository.findById(EXPORT_ID)).willReturn(Optional.of(pendingExport()));
        saveReturnsArgument();

        // when
        ReportExport completed = reportExportService.markCompleted(EXPORT_ID, null, "sha256:abc");

        // then
        assertThat(completed.status()).isEqualTo(ExportStatus.COMPLETED);
        assertThat(completed.exportedAt()).isEqualTo(NOW);
        assertThat(completed.fileSize()).isEqualTo(1024L);
        assertThat(completed.fileHash()).isEqualTo("sha256:abc");
    }

    @Test
    @DisplayName("다운로드 기록 - 횟수 증가와 마지막 다운로드 시각")
    void recordDownload() {
        // given
        given(reportExportRepository.findById(EXPORT_ID)).willReturn(Optional.of(pendingExport()));
        saveReturnsArgument();

        // when
        ReportExport downloaded = reportExportService.recordDownload(EXPORT_ID);

        // then
        assertThat(downloaded.downloadCount()).isEqualTo(1);
        assertThat(downloaded.lastDownloadedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("내보내기 실패 기록 실패 - 내보내기 없음")
    void markFailed_NotFound() {
        // given
        given(reportExportRepository.findById(EXPORT_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> reportExportService.markFailed(EXPORT_ID, "disk full"))
                .isInstanceOf(ExportNotFoundException.class);
    }
}
