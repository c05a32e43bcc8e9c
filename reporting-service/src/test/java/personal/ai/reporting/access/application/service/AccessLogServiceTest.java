package personal.ai.reporting.access.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.common.exception.BusinessException;
import personal.ai.reporting.access.application.port.in.LogAccessCommand;
import personal.ai.reporting.access.application.port.out.AccessLogRepository;
import personal.ai.reporting.access.domain.model.AccessLog;
import personal.ai.reporting.access.domain.model.AccessStatistics;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessLogService 단위 테스트")
class AccessLogServiceTest {

    private static final Long REPORT_ID = 10L;
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 9, 0);

    @Mock
    private AccessLogRepository accessLogRepository;

    private AccessLogService accessLogService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T09:00:00Z"), ZoneOffset.UTC);
        accessLogService = new AccessLogService(accessLogRepository, clock);
    }

    @Test
    @DisplayName("접근 기록 - 상태 미지정 시 success, 접근 시각은 현재 시각")
    void logAccess_DefaultStatus() {
        // given
        willAnswer(invocation -> invocation.getArgument(0))
                .given(accessLogRepository).save(any(AccessLog.class));
        LogAccessCommand command = new LogAccessCommand(
                REPORT_ID, 1L, "view", null, "10.0.0.1", "curl", null, 3);

        // when
        AccessLog saved = accessLogService.logAccess(command);

        // then
        assertThat(saved.accessStatus()).isEqualTo("success");
        assertThat(saved.accessedAt()).isEqualTo(NOW);
        assertThat(saved.durationSeconds()).isEqualTo(3);
    }

    @Test
    @DisplayName("접근 기록 실패 - 접근 유형 누락")
    void logAccess_MissingType() {
        // given
        LogAccessCommand command = new LogAccessCommand(
                REPORT_ID, 1L, " ", null, null, null, null, null);

        // when & then
        assertThatThrownBy(() -> accessLogService.logAccess(command))
                .isInstanceOf(BusinessException.class);
        verify(accessLogRepository, never()).save(any());
    }

    @Test
    @DisplayName("접근 통계 - 성공/실패, 유형별, 사용자 수 집계")
    void getAccessStatistics() {
        // given
        given(accessLogRepository.findAllByReportId(REPORT_ID)).willReturn(List.of(
                log(1L, "view", "success"),
                log(1L, "download", "failed"),
                log(2L, "view", null)));

        // when
        AccessStatistics statistics = accessLogService.getAccessStatistics(REPORT_ID);

        // then
        assertThat(statistics.totalAccesses()).isEqualTo(3);
        assertThat(statistics.successful()).isEqualTo(2);
        assertThat(statistics.failed()).isEqualTo(1);
        assertThat(statistics.byType()).containsEntry("view", 2L).containsEntry("download", 1L);
        assertThat(statistics.uniqueUsers()).isEqualTo(2);
    }

    private AccessLog log(Long userId, String type, String status) {
        return new AccessLog(null, REPORT_ID, userId, type, status, null, null, null, null, NOW);
    }
}
