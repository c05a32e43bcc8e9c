package personal.ai.reporting.schedule.adapter.out.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import personal.ai.reporting.schedule.application.port.out.SchedulerLockPort;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Cluster Lock Adapter
 * Redis SET NX 기반 스케줄별 분산 락
 * <p>
 * 락 값은 인스턴스 ID이며, 해제는 Lua Script로 소유자일 때만 수행
 * 해제되지 않은 락은 TTL 만료로 정리됨
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterLockAdapter implements SchedulerLockPort {

    private static final String UNLOCK_SCRIPT = """
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """;

    private final StringRedisTemplate redisTemplate;
    private final Duration lockTtl;

    private final String instanceId = UUID.randomUUID().toString();

    @Override
    public boolean tryAcquire(String schedulerName, String resourceId) {
        String lockKey = buildLockKey(schedulerName, resourceId);

        try {
            boolean acquired = Boolean.TRUE.equals(
                    redisTemplate.opsForValue().setIfAbsent(lockKey, instanceId, lockTtl));

            if (acquired) {
                log.debug("[ClusterLock] Lock acquired: key={}, instanceId={}", lockKey, instanceId);
            } else {
                log.debug("[ClusterLock] Lock held by another instance: key={}", lockKey);
            }
            return acquired;
        } catch (Exception e) {
            // Redis 장애 시 실행하지 않음
            log.error("[ClusterLock] Failed to acquire lock: key={}", lockKey, e);
            return false;
        }
    }

    @Override
    public void release(String schedulerName, String resourceId) {
        String lockKey = buildLockKey(schedulerName, resourceId);

        try {
            Long released = redisTemplate.execute(
                    new DefaultRedisScript<>(UNLOCK_SCRIPT, Long.class),
                    List.of(lockKey),
                    instanceId);

            if (released != null && released > 0) {
                log.debug("[ClusterLock] Lock released: key={}", lockKey);
            } else {
                log.debug("[ClusterLock] Lock not released (not owner or expired): key={}", lockKey);
            }
        } catch (Exception e) {
            // TTL 만료로 해제되므로 전파하지 않음
            log.error("[ClusterLock] Failed to release lock: key={}", lockKey, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "cluster";
    }

    /**
     * Hash Tag {resourceId}로 같은 스케줄의 락 키가 같은 슬롯에 위치
     */
    private String buildLockKey(String schedulerName, String resourceId) {
        return String.format("reporting:scheduler:lock:%s:{%s}", schedulerName, resourceId);
    }
}
