package personal.ai.reporting.schedule.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scheduler Lock 설정 Properties
 *
 * scheduler:
 *   lock:
 *     strategy: cluster  # none | cluster
 *     ttl-seconds: 120
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "scheduler.lock")
public class SchedulerLockProperties {

    /**
     * none: 락 사용 안 함, cluster: Redis 분산 락
     */
    private String strategy = "none";

    /**
     * 락 TTL (초). 스케줄 한 건의 최대 처리 시간보다 길어야 함
     */
    private int ttlSeconds = 120;
}
