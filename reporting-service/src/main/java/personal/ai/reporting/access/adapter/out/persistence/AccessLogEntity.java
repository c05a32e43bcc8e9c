package personal.ai.reporting.access.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.reporting.access.domain.model.AccessLog;

import java.time.LocalDateTime;

/**
 * Report Access Log JPA Entity
 */
@Entity
@Table(name = "report_access_logs",
        indexes = {
                @Index(name = "idx_report_access_report_user", columnList = "report_id, user_id"),
                @Index(name = "idx_report_access_type_date", columnList = "access_type, accessed_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccessLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_id", nullable = false)
    private Long reportId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "access_type", nullable = false, length = 50)
    private String accessType;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "access_status", length = 50)
    private String accessStatus;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "access_duration_seconds")
    private Integer durationSeconds;

    @Column(name = "accessed_at", nullable = false, updatable = false)
    private LocalDateTime accessedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static AccessLogEntity fromDomain(AccessLog accessLog) {
        AccessLogEntity entity = new AccessLogEntity();
        entity.id = accessLog.id();
        entity.reportId = accessLog.reportId();
        entity.userId = accessLog.userId();
        entity.accessType = accessLog.accessType();
        entity.ipAddress = accessLog.ipAddress();
        entity.userAgent = accessLog.userAgent();
        entity.accessStatus = accessLog.accessStatus();
        entity.errorMessage = accessLog.errorMessage();
        entity.durationSeconds = accessLog.durationSeconds();
        entity.accessedAt = accessLog.accessedAt();
        return entity;
    }

    public AccessLog toDomain() {
        return new AccessLog(id, reportId, userId, accessType, accessStatus, ipAddress, userAgent,
                errorMessage, durationSeconds, accessedAt);
    }
}
