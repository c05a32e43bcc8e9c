package personal.ai.reporting.schedule.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.ai.reporting.schedule.application.port.out.SchedulerLockPort;

import java.time.Duration;

/**
 * Scheduler Lock Adapter Factory
 * scheduler.lock.strategy 값에 따라 SchedulerLockPort 구현체를 선택
 */
@Slf4j
@Configuration
public class SchedulerLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "scheduler.lock.strategy", havingValue = "none", matchIfMissing = true)
    public SchedulerLockPort noLockAdapter() {
        log.info("Creating NoLockAdapter - schedules run without a distributed lock");
        return new NoLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "scheduler.lock.strategy", havingValue = "cluster")
    public SchedulerLockPort clusterLockAdapter(
            StringRedisTemplate redisTemplate,
            SchedulerLockProperties properties) {

        log.info("Creating ClusterLockAdapter - TTL: {}s", properties.getTtlSeconds());
        return new ClusterLockAdapter(redisTemplate, Duration.ofSeconds(properties.getTtlSeconds()));
    }
}
