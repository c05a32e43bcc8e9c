package personal.ai.reporting.schedule.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Schedule
 */
public interface JpaScheduleRepository extends JpaRepository<ScheduleEntity, Long> {

    Optional<ScheduleEntity> findByIdAndDeletedFalse(Long id);

    /**
     * 실행 결과 기록용 조회 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ScheduleEntity s WHERE s.id = :id AND s.deleted = false")
    Optional<ScheduleEntity> findByIdForUpdate(@Param("id") Long id);

    List<ScheduleEntity> findByEnabledTrueAndDeletedFalseAndNextRunAtLessThanEqual(LocalDateTime now);

    Page<ScheduleEntity> findByUserIdAndDeletedFalse(Long userId, Pageable pageable);
}
