package personal.ai.reporting.metric.adapter.out.persistence;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA Repository for ReportMetric
 */
public interface JpaReportMetricRepository extends JpaRepository<ReportMetricEntity, Long> {

    Page<ReportMetricEntity> findByReportIdAndDeletedFalse(Long reportId, Pageable pageable);

    Page<ReportMetricEntity> findByCategoryAndDeletedFalse(String category, Pageable pageable);

    /**
     * 기간 내 지표 값 조회 (통계 계산용)
     */
    @Query("SELECT m.value FROM ReportMetricEntity m "
            + "WHERE m.name = :name AND m.recordedAt >= :since AND m.deleted = false")
    List<BigDecimal> findValuesByNameSince(@Param("name") String name,
                                           @Param("since") LocalDateTime since);
}
