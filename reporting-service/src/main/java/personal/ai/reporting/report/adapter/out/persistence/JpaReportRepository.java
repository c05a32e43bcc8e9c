package personal.ai.reporting.report.adapter.out.persistence;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import personal.ai.reporting.report.domain.model.ReportStatus;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Report
 */
public interface JpaReportRepository extends JpaRepository<ReportEntity, Long> {

    Optional<ReportEntity> findByIdAndDeletedFalse(Long id);

    boolean existsByIdAndDeletedFalse(Long id);

    Page<ReportEntity> findByUserIdAndDeletedFalse(Long userId, Pageable pageable);

    Page<ReportEntity> findByUserIdAndStatusAndDeletedFalse(Long userId, ReportStatus status, Pageable pageable);
}
