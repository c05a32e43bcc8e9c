package personal.ai.reporting.schedule.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.ai.common.dto.PageResponse;
import personal.ai.reporting.schedule.application.port.out.ScheduleRepository;
import personal.ai.reporting.schedule.domain.model.Schedule;
import personal.ai.reporting.support.OffsetPageRequest;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Schedule Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulePersistenceAdapter implements ScheduleRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final JpaScheduleRepository jpaScheduleRepository;
    private final Clock clock;

    @Override
    public Schedule save(Schedule schedule) {
        log.debug("Saving schedule: scheduleId={}, runCount={}", schedule.id(), schedule.runCount());
        ScheduleEntity entity = ScheduleEntity.fromDomain(schedule);
        entity.touch(LocalDateTime.now(clock));
        return jpaScheduleRepository.save(entity).toDomain();
    }

    @Override
    public Optional<Schedule> findById(Long scheduleId) {
        return jpaScheduleRepository.findByIdAndDeletedFalse(scheduleId)
                .map(ScheduleEntity::toDomain);
    }

    @Override
    public Optional<Schedule> findByIdForUpdate(Long scheduleId) {
        return jpaScheduleRepository.findByIdForUpdate(scheduleId)
                .map(ScheduleEntity::toDomain);
    }

    @Override
    public List<Schedule> findDue(LocalDateTime now) {
        return jpaScheduleRepository.findByEnabledTrueAndDeletedFalseAndNextRunAtLessThanEqual(now).stream()
                .map(ScheduleEntity::toDomain)
                .toList();
    }

    @Override
    public PageResponse<Schedule> findByUserId(Long userId, int limit, int offset) {
        Page<ScheduleEntity> page = jpaScheduleRepository.findByUserIdAndDeletedFalse(
                userId, OffsetPageRequest.of(limit, offset, NEWEST_FIRST));
        var items = page.getContent().stream()
                .map(ScheduleEntity::toDomain)
                .toList();
        return new PageResponse<>(items, page.getTotalElements(), limit, offset);
    }
}
