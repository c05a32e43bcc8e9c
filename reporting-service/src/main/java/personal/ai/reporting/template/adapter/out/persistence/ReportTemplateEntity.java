package personal.ai.reporting.template.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.ai.reporting.support.StringListJsonConverter;
import personal.ai.reporting.template.domain.model.ReportTemplate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Report Template JPA Entity
 * 보고서 템플릿 테이블 매핑
 */
@Entity
@Table(name = "report_templates",
        indexes = {
                @Index(name = "idx_report_templates_type_active", columnList = "template_type, is_active"),
                @Index(name = "idx_report_templates_name", columnList = "template_name")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReportTemplateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "template_name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "template_type", nullable = false, length = 50)
    private String type;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Convert(converter = StringListJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> sections;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "export_formats", columnDefinition = "TEXT")
    private List<String> exportFormats;

    @Column(name = "is_default", nullable = false)
    private boolean defaultTemplate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ReportTemplateEntity fromDomain(ReportTemplate template) {
        ReportTemplateEntity entity = new ReportTemplateEntity();
        entity.id = template.id();
        entity.name = template.name();
        entity.type = template.type();
        entity.description = template.description();
        entity.sections = template.sections();
        entity.exportFormats = template.exportFormats();
        entity.defaultTemplate = template.defaultTemplate();
        entity.active = template.active();
        entity.createdAt = template.createdAt();
        entity.updatedAt = template.updatedAt();
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

    /**
     * 도메인 모델로 변환
     */
    public ReportTemplate toDomain() {
        return new ReportTemplate(id, name, type, description, sections, exportFormats,
                defaultTemplate, active, createdAt, updatedAt);
    }
}
