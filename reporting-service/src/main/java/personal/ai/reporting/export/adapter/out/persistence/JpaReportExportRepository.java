package personal.ai.reporting.export.adapter.out.persistence;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for ReportExport
 */
public interface JpaReportExportRepository extends JpaRepository<ReportExportEntity, Long> {

    Optional<ReportExportEntity> findByIdAndDeletedFalse(Long id);

    Page<ReportExportEntity> findByReportIdAndDeletedFalse(Long reportId, Pageable pageable);
}
