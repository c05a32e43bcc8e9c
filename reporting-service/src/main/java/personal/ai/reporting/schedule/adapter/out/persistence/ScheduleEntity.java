package personal.ai.reporting.schedule.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.reporting.schedule.domain.model.DeliveryTarget;
import personal.ai.reporting.schedule.domain.model.Schedule;
import personal.ai.reporting.schedule.domain.model.TimeOfDay;
import personal.ai.reporting.support.StringListJsonConverter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Report Schedule JPA Entity
 */
@Entity
@Table(name = "report_schedules",
        indexes = {
                @Index(name = "idx_report_schedules_user_enabled", columnList = "user_id, is_enabled"),
                @Index(name = "idx_report_schedules_next_run", columnList = "next_run_at, is_enabled")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ScheduleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "template_id", nullable = false)
    private Long templateId;

    @Column(name = "schedule_name", nullable = false)
    private String name;

    @Column(nullable = false, length = 50)
    private String frequency;

    @Column(name = "day_of_week")
    private Integer dayOfWeek;

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(name = "time_of_day", nullable = false, length = 5)
    private String timeOfDay;

    @Column(length = 50)
    private String timezone;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled;

    @Column(name = "next_run_at")
    private LocalDateTime nextRunAt;

    @Column(name = "last_run_at")
    private LocalDateTime lastRunAt;

    @Column(name = "run_count", nullable = false)
    private int runCount;

    @Column(name = "success_count", nullable = false)
    private int successCount;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Convert(converter = StringListJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> recipients;

    @Column(name = "delivery_method", length = 50)
    private String deliveryMethod;

    @Column(name = "webhook_url", length = 500)
    private String webhookUrl;

    @Column(name = "include_file", nullable = false)
    private boolean includeFile;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public static ScheduleEntity fromDomain(Schedule schedule) {
        ScheduleEntity entity = new ScheduleEntity();
        entity.id = schedule.id();
        entity.userId = schedule.userId();
        entity.templateId = schedule.templateId();
        entity.name = schedule.name();
        entity.frequency = schedule.frequency();
        entity.dayOfWeek = schedule.dayOfWeek();
        entity.dayOfMonth = schedule.dayOfMonth();
        entity.timeOfDay = schedule.timeOfDay().format();
        entity.timezone = schedule.timezone();
        entity.enabled = schedule.enabled();
        entity.nextRunAt = schedule.nextRunAt();
        entity.lastRunAt = schedule.lastRunAt();
        entity.runCount = schedule.runCount();
        entity.successCount = schedule.successCount();
        entity.failureCount = schedule.failureCount();
        entity.recipients = schedule.delivery().recipients();
        entity.deliveryMethod = schedule.delivery().method();
        entity.webhookUrl = schedule.delivery().webhookUrl();
        entity.includeFile = schedule.delivery().includeFile();
        entity.createdAt = schedule.createdAt();
        entity.updatedAt = schedule.updatedAt();
        return entity;
    }

    /**
     * 생성/수정 시각은 주입된 Clock 기준으로 어댑터가 기록
     */
    void touch(LocalDateTime now) {
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    public Schedule toDomain() {
        return new Schedule(id, userId, templateId, name, frequency, TimeOfDay.parse(timeOfDay),
                dayOfWeek, dayOfMonth, timezone, enabled, nextRunAt, lastRunAt,
                runCount, successCount, failureCount,
                new DeliveryTarget(deliveryMethod, recipients, webhookUrl, includeFile),
                createdAt, updatedAt);
    }
}
