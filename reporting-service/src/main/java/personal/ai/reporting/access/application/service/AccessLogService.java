package personal.ai.reporting.access.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.access.application.port.in.AccessLogUseCase;
import personal.ai.reporting.access.application.port.in.LogAccessCommand;
import personal.ai.reporting.access.application.port.out.AccessLogRepository;
import personal.ai.reporting.access.domain.model.AccessLog;
import personal.ai.reporting.access.domain.model.AccessStatistics;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Report Access Log Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AccessLogService implements AccessLogUseCase {

    private final AccessLogRepository accessLogRepository;
    private final Clock clock;

    @Override
    @Transactional
    public AccessLog logAccess(LogAccessCommand command) {
        AccessLog accessLog = new AccessLog(
                null,
                command.reportId(),
                command.userId(),
                command.accessType(),
                command.accessStatus(),
                command.ipAddress(),
                command.userAgent(),
                command.errorMessage(),
                command.durationSeconds(),
                LocalDateTime.now(clock));

        AccessLog saved = accessLogRepository.save(accessLog);
        log.debug("Report access logged: reportId={}, userId={}, type={}, status={}",
                saved.reportId(), saved.userId(), saved.accessType(), saved.accessStatus());
        return saved;
    }

    @Override
    public PageResponse<AccessLog> getReportAccessLogs(Long reportId, int limit, int offset) {
        return accessLogRepository.findByReportId(reportId, limit, offset);
    }

    @Override
    public PageResponse<AccessLog> getUserAccessLogs(Long userId, int limit, int offset) {
        return accessLogRepository.findByUserId(userId, limit, offset);
    }

    @Override
    public AccessStatistics getAccessStatistics(Long reportId) {
        return AccessStatistics.of(accessLogRepository.findAllByReportId(reportId));
    }
}
