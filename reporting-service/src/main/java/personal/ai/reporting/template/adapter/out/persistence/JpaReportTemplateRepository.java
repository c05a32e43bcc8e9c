package personal.ai.reporting.template.adapter.out.persistence;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for ReportTemplate
 */
public interface JpaReportTemplateRepository extends JpaRepository<ReportTemplateEntity, Long> {

    Optional<ReportTemplateEntity> findByIdAndDeletedFalse(Long id);

    Optional<ReportTemplateEntity> findByNameAndDeletedFalse(String name);

    boolean existsByIdAndDeletedFalse(Long id);

    /**
     * 유니크 제약은 삭제된 행에도 적용되므로 삭제 여부와 무관하게 확인
     */
    boolean existsByName(String name);

    Page<ReportTemplateEntity> findByTypeAndDeletedFalse(String type, Pageable pageable);

    Page<ReportTemplateEntity> findByActiveTrueAndDeletedFalse(Pageable pageable);
}
