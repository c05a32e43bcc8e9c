package personal.ai.reporting.access.adapter.out.persistence;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Spring Data JPA Repository for AccessLog
 */
public interface JpaAccessLogRepository extends JpaRepository<AccessLogEntity, Long> {

    Page<AccessLogEntity> findByReportIdAndDeletedFalse(Long reportId, Pageable pageable);

    Page<AccessLogEntity> findByUserIdAndDeletedFalse(Long userId, Pageable pageable);

    List<AccessLogEntity> findByReportIdAndDeletedFalse(Long reportId);
}
